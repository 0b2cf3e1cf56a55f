package com.example.admission.presentation.controller;

import com.example.admission.common.exception.InvalidRequestException;
import com.example.admission.common.exception.RuleConfigurationException;
import com.example.admission.presentation.dto.AdmissionDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * 전역 예외 처리 핸들러
 *
 * SOLID 원칙:
 * - Single Responsibility: 예외 처리 및 에러 응답 생성만 담당
 *
 * 예상하지 못한 예외의 메시지는 응답에 노출하지 않는다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String INTERNAL_ERROR_MESSAGE = "An internal server error occurred. Please try again later.";

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<AdmissionDto.ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
        log.debug("Invalid request: {}", ex.getMessage());
        return badRequest(ex.getMessage(), List.of());
    }

    /**
     * 규칙 리로드 거부. 기존 규칙은 그대로 유지된다.
     */
    @ExceptionHandler(RuleConfigurationException.class)
    public ResponseEntity<AdmissionDto.ErrorResponse> handleRuleConfiguration(RuleConfigurationException ex) {
        log.warn("Rule reload rejected: {}", ex.getMessage());
        return badRequest("Invalid rule configuration", ex.getErrors());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AdmissionDto.ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return badRequest("Validation failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<AdmissionDto.ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return badRequest("Malformed request body", List.of());
    }

    /**
     * 일반 예외 처리
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<AdmissionDto.ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);

        AdmissionDto.ErrorResponse response = AdmissionDto.ErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error("Internal Server Error")
                .message(INTERNAL_ERROR_MESSAGE)
                .timestamp(Instant.now())
                .build();

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(response);
    }

    private static ResponseEntity<AdmissionDto.ErrorResponse> badRequest(String message, List<String> details) {
        AdmissionDto.ErrorResponse response = AdmissionDto.ErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Bad Request")
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.badRequest().body(response);
    }
}
