package com.example.admission.common.exception;

/**
 * 개별 탐지기 실패 예외. 다른 탐지기나 전체 분석을 중단시키지 않는다.
 */
public class DetectorException extends RuntimeException {

    private final String detector;

    public DetectorException(String detector, String message, Throwable cause) {
        super(message, cause);
        this.detector = detector;
    }

    public String getDetector() {
        return detector;
    }
}
