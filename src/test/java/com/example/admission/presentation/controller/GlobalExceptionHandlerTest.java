package com.example.admission.presentation.controller;

import com.example.admission.common.exception.InvalidRequestException;
import com.example.admission.common.exception.RuleConfigurationException;
import com.example.admission.presentation.dto.AdmissionDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * GlobalExceptionHandler 테스트
 */
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    @DisplayName("InvalidRequestException 발생 시 400 응답 반환")
    void handleInvalidRequestExceptionTest() {
        // given
        InvalidRequestException exception = new InvalidRequestException("userId or ip is required");

        // when
        ResponseEntity<AdmissionDto.ErrorResponse> response = handler.handleInvalidRequest(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getStatus()).isEqualTo(400);
        assertThat(response.getBody().getError()).isEqualTo("Bad Request");
        assertThat(response.getBody().getMessage()).isEqualTo("userId or ip is required");
    }

    @Test
    @DisplayName("RuleConfigurationException 발생 시 400 응답과 오류 목록 반환")
    void handleRuleConfigurationExceptionTest() {
        // given
        RuleConfigurationException exception = new RuleConfigurationException(List.of(
                "rule 'a': limit must not be negative",
                "rule 'b': match is required for ENDPOINT scope"));

        // when
        ResponseEntity<AdmissionDto.ErrorResponse> response = handler.handleRuleConfiguration(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getMessage()).isEqualTo("Invalid rule configuration");
        assertThat(response.getBody().getDetails()).hasSize(2);
    }

    @Test
    @DisplayName("일반 Exception 발생 시 500 응답 및 마스킹된 메시지 반환")
    void handleGenericExceptionTest() {
        // given
        Exception exception = new RuntimeException("Internal database connection failed");

        // when
        ResponseEntity<AdmissionDto.ErrorResponse> response = handler.handleGenericException(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getStatus()).isEqualTo(500);
        assertThat(response.getBody().getError()).isEqualTo("Internal Server Error");
        // 내부 메시지가 노출되지 않음
        assertThat(response.getBody().getMessage())
                .isEqualTo("An internal server error occurred. Please try again later.")
                .doesNotContain("database connection");
    }

    @Test
    @DisplayName("IllegalArgumentException은 500으로 처리되어 내부 정보 노출 방지")
    void illegalArgumentExceptionNotHandledAs400Test() {
        // given
        IllegalArgumentException exception =
                new IllegalArgumentException("Internal validation failed: secret detail");

        // when
        ResponseEntity<AdmissionDto.ErrorResponse> response = handler.handleGenericException(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getMessage())
                .isEqualTo(GlobalExceptionHandler.INTERNAL_ERROR_MESSAGE)
                .doesNotContain("secret detail");
    }
}
