package com.example.admission.domain.behavior;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 등록된 속성만 아는 기본 IdentityDirectory. 등록되지 않은 사용자는 empty.
 */
public class InMemoryIdentityDirectory implements IdentityDirectory {

    private final Map<String, IdentityAttributes> attributes = new ConcurrentHashMap<>();

    public void register(String userId, Instant createdAt, boolean mfaEnabled) {
        attributes.put(userId, new IdentityAttributes(createdAt, mfaEnabled));
    }

    @Override
    public Optional<IdentityAttributes> lookup(String userId) {
        return Optional.ofNullable(attributes.get(userId));
    }
}
