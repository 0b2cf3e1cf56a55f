package com.example.admission.common.exception;

/**
 * 공유 상태 저장소 트랜잭션 실패 예외 (연결 불가, 타임아웃, CAS 재시도 초과)
 *
 * 호출 측은 이 예외를 fail-open으로 처리한다.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
