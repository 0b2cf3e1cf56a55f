package com.example.admission.infrastructure.redis;

import com.example.admission.common.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis Lua Script 실행 구현체
 *
 * 개선 사항:
 * - DefaultRedisScript 캐싱으로 EVALSHA 재사용
 * - 모든 Redis 오류는 StoreUnavailableException으로 변환 (호출 측 fail-open 처리)
 */
@Slf4j
@RequiredArgsConstructor
public class RedisScriptExecutorImpl implements RedisScriptExecutor {

    private final StringRedisTemplate redisTemplate;

    // Lua 스크립트 텍스트 기준으로 캐싱하여 불필요한 객체 생성 방지
    @SuppressWarnings("rawtypes")
    private final Map<String, DefaultRedisScript<List>> scriptCache = new ConcurrentHashMap<>();

    @Override
    public List<Long> executeLuaScript(String script, List<String> keys, List<String> args) {
        List<Object> raw = executeRawLuaScript(script, keys, args);

        List<Long> longResult = new ArrayList<>();
        for (Object obj : raw) {
            if (obj instanceof Number) {
                longResult.add(((Number) obj).longValue());
            } else if (obj instanceof String) {
                longResult.add(Long.parseLong((String) obj));
            }
        }
        return longResult;
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"}) // DefaultRedisScript<List>의 raw List는 Spring API 제약
    public List<Object> executeRawLuaScript(String script, List<String> keys, List<String> args) {
        try {
            DefaultRedisScript<List> redisScript = scriptCache.computeIfAbsent(script, s -> {
                DefaultRedisScript<List> newScript = new DefaultRedisScript<>();
                newScript.setScriptText(s);
                newScript.setResultType(List.class);
                return newScript;
            });

            List<Object> result = redisTemplate.execute(redisScript, keys, args.toArray());

            if (result == null) {
                return Collections.emptyList();
            }
            return result;

        } catch (RuntimeException e) {
            log.error("Failed to execute Lua script on keys {}", keys, e);
            throw new StoreUnavailableException("Redis script execution failed", e);
        }
    }

    @Override
    public void deleteKeys(String... keys) {
        if (keys == null || keys.length == 0) {
            return;
        }
        try {
            redisTemplate.delete(List.of(keys));
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Redis delete failed", e);
        }
    }
}
