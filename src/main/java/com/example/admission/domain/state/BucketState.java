package com.example.admission.domain.state;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token Bucket과 Leaky Bucket에서 사용되는 버킷 상태 클래스
 *
 * Token Bucket이면 value는 남은 토큰 수, Leaky Bucket이면 현재 수위(level)다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BucketState {
    private double value;          // 토큰 수 또는 수위
    private long lastUpdateMillis; // 마지막 리필/누출 계산 시각
}
