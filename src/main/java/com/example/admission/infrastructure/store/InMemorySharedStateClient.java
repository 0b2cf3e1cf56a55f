package com.example.admission.infrastructure.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 단일 프로세스용 SharedStateClient 구현
 *
 * ConcurrentHashMap.compute가 키 단위로 직렬화되므로 transact는 원자적이다.
 * 만료된 키는 조회 시점에 무시되고 evictExpired()로 정리된다.
 */
@Slf4j
public class InMemorySharedStateClient implements SharedStateClient {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final StateCodec codec;
    private final Clock clock;

    public InMemorySharedStateClient(StateCodec codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public <S, R> R transact(String key, Class<S> stateType, StateTransition<S, R> transition, long callerNowMillis) {
        AtomicReference<R> result = new AtomicReference<>();
        entries.compute(key, (k, entry) -> {
            Entry live = entry != null && !entry.isExpired(callerNowMillis) ? entry : null;
            S current = live == null ? null : codec.decode(live.value, stateType);

            StateOutcome<S, R> outcome = transition.apply(current, callerNowMillis);
            result.set(outcome.getResult());

            if (!outcome.isWrite()) {
                return live;
            }
            return new Entry(codec.encode(outcome.getNewState()), callerNowMillis + outcome.getTtl().toMillis());
        });
        return result.get();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.millis() + ttl.toMillis()));
    }

    @Override
    public Optional<String> get(String key) {
        return live(key).map(entry -> entry.value);
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        long now = clock.millis();
        return live(key).map(entry -> Duration.ofMillis(entry.expiresAtMillis - now));
    }

    @Override
    public void delete(String... keys) {
        for (String key : keys) {
            entries.remove(key);
        }
    }

    /**
     * 만료된 키 정리
     *
     * @return 제거된 키 수
     */
    public int evictExpired() {
        long now = clock.millis();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int removed = before - entries.size();
        if (removed > 0 && log.isDebugEnabled()) {
            log.debug("Evicted {} expired keys", removed);
        }
        return Math.max(0, removed);
    }

    int size() {
        return entries.size();
    }

    private Optional<Entry> live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private static final class Entry {
        private final String value;
        private final long expiresAtMillis;

        private Entry(String value, long expiresAtMillis) {
            this.value = value;
            this.expiresAtMillis = expiresAtMillis;
        }

        private boolean isExpired(long nowMillis) {
            return nowMillis >= expiresAtMillis;
        }
    }
}
