package com.example.admission.infrastructure.store;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 인메모리 저장소의 만료 키 정리. Redis는 TTL로 스스로 정리하므로 아무 일도 하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class ExpiredStateSweeper {

    private final SharedStateClient stateClient;

    @Scheduled(fixedDelayString = "${admission.store.eviction-interval:PT30S}")
    public void sweep() {
        if (stateClient instanceof InMemorySharedStateClient) {
            ((InMemorySharedStateClient) stateClient).evictExpired();
        }
    }
}
