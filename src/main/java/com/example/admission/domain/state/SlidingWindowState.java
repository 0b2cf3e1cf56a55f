package com.example.admission.domain.state;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding Window 상태: 윈도우 안에서 허용된 요청의 타임스탬프(ms, 오름차순)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlidingWindowState {
    private List<Long> timestamps = new ArrayList<>();
}
