package com.example.admission.common.exception;

/**
 * 잘못된 요청 파라미터 예외
 *
 * IllegalArgumentException 대신 사용하여 의도된 검증 실패만 400 응답으로 처리.
 * 예상치 못한 IllegalArgumentException은 500으로 처리되어 내부 정보 노출 방지.
 *
 * 사용 예:
 * - RateLimitRequest 필수 필드(ip, endpoint, method) 누락
 * - 형식이 잘못된 IP 주소
 *
 * 이 예외가 발생하면 카운터는 전혀 건드리지 않는다.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
