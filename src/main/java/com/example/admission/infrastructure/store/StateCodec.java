package com.example.admission.infrastructure.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * 카운터 상태 JSON 직렬화
 *
 * 손상된 값은 빈 상태(null)로 취급한다.
 */
@Slf4j
public class StateCodec {

    private final ObjectMapper objectMapper;

    public StateCodec() {
        this(new ObjectMapper());
    }

    public StateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(Object state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode state " + state.getClass().getSimpleName(), e);
        }
    }

    public <S> S decode(String value, Class<S> type) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(value, type);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable {} state", type.getSimpleName());
            return null;
        }
    }
}
