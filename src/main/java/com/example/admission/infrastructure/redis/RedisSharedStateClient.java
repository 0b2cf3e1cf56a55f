package com.example.admission.infrastructure.redis;

import com.example.admission.common.exception.StoreUnavailableException;
import com.example.admission.infrastructure.store.SharedStateClient;
import com.example.admission.infrastructure.store.StateCodec;
import com.example.admission.infrastructure.store.StateOutcome;
import com.example.admission.infrastructure.store.StateTransition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis 기반 SharedStateClient
 *
 * transact는 낙관적 CAS로 동작한다:
 * 1. READ 스크립트로 현재 값과 Redis 서버 시간(TIME)을 한 번에 읽음 (clock skew 방지)
 * 2. 애플리케이션에서 순수 함수로 새 상태 계산
 * 3. CAS 스크립트로 값이 그대로일 때만 SET PX
 * 4. 충돌 시 재시도, 한도 초과 시 StoreUnavailableException
 *
 * 결과적으로 키 하나에 대한 read-modify-write는 Redis가 직렬화하며 부분 커밋은 존재하지 않는다.
 */
@Slf4j
public class RedisSharedStateClient implements SharedStateClient {

    private static final String READ_SCRIPT = """
            local value = redis.call('GET', KEYS[1])
            if not value then
                value = ''
            end
            local time = redis.call('TIME')
            return {value, tostring(time[1]), tostring(time[2])}
            """;

    private static final String CAS_SCRIPT = """
            local current = redis.call('GET', KEYS[1])
            if not current then
                current = ''
            end
            if current ~= ARGV[1] then
                return {0}
            end
            redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
            return {1}
            """;

    private final RedisScriptExecutor scriptExecutor;
    private final StringRedisTemplate redisTemplate;
    private final StateCodec codec;
    private final int maxCasAttempts;
    private final long maxClockSkewMillis;

    public RedisSharedStateClient(RedisScriptExecutor scriptExecutor,
                                  StringRedisTemplate redisTemplate,
                                  StateCodec codec,
                                  int maxCasAttempts,
                                  Duration maxClockSkew) {
        if (maxCasAttempts <= 0) {
            throw new IllegalArgumentException("maxCasAttempts must be positive: " + maxCasAttempts);
        }
        this.scriptExecutor = scriptExecutor;
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.maxCasAttempts = maxCasAttempts;
        this.maxClockSkewMillis = maxClockSkew.toMillis();
    }

    @Override
    public <S, R> R transact(String key, Class<S> stateType, StateTransition<S, R> transition, long callerNowMillis) {
        for (int attempt = 1; attempt <= maxCasAttempts; attempt++) {
            List<Object> snapshot = scriptExecutor.executeRawLuaScript(READ_SCRIPT, List.of(key), List.of());
            if (snapshot.size() < 3) {
                throw new StoreUnavailableException("Unexpected read result for " + key);
            }

            String raw = String.valueOf(snapshot.get(0));
            long serverNow = Long.parseLong(String.valueOf(snapshot.get(1))) * 1000L
                    + Long.parseLong(String.valueOf(snapshot.get(2))) / 1000L;
            warnOnSkew(serverNow, callerNowMillis);

            S current = codec.decode(raw, stateType);
            StateOutcome<S, R> outcome = transition.apply(current, serverNow);
            if (!outcome.isWrite()) {
                return outcome.getResult();
            }

            List<Long> swapped = scriptExecutor.executeLuaScript(
                    CAS_SCRIPT,
                    List.of(key),
                    List.of(
                            raw,
                            codec.encode(outcome.getNewState()),
                            String.valueOf(outcome.getTtl().toMillis())
                    )
            );
            if (!swapped.isEmpty() && swapped.get(0) == 1L) {
                return outcome.getResult();
            }

            if (log.isDebugEnabled()) {
                log.debug("CAS conflict on {} (attempt {}/{})", key, attempt, maxCasAttempts);
            }
            Thread.onSpinWait();
        }
        throw new StoreUnavailableException("CAS retries exhausted for " + key);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis SET failed for " + key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis GET failed for " + key, e);
        }
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        try {
            Long millis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
            // -2: 키 없음, -1: 만료 없음
            if (millis == null || millis == -2L) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofMillis(Math.max(0L, millis)));
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis PTTL failed for " + key, e);
        }
    }

    @Override
    public void delete(String... keys) {
        scriptExecutor.deleteKeys(keys);
    }

    private void warnOnSkew(long serverNow, long callerNow) {
        long skew = Math.abs(serverNow - callerNow);
        if (skew > maxClockSkewMillis) {
            log.warn("Clock skew of {} ms between caller and Redis exceeds tolerance of {} ms; using Redis time",
                    skew, maxClockSkewMillis);
        }
    }
}
