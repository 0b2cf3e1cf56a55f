package com.example.admission.infrastructure.redis;

import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleCheckResult;
import com.example.admission.domain.strategy.SlidingWindowStrategy;
import com.example.admission.infrastructure.store.StateCodec;
import com.redis.testcontainers.RedisContainer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Redis 기반 SharedStateClient 통합 테스트 (Testcontainers 사용, Docker 없으면 건너뜀)
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisSharedStateClientIntegrationTest {

    @Container
    static RedisContainer redis = new RedisContainer(
            DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;
    private static RedisScriptExecutor scriptExecutor;
    private static RedisSharedStateClient client;

    private final RateLimitRule rule = RateLimitRule.builder()
            .name("global")
            .algorithm(AlgorithmType.SLIDING_WINDOW)
            .limit(5)
            .windowSizeSeconds(60)
            .keyPattern("global:{userId}")
            .build();

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(redis.getHost(), redis.getFirstMappedPort());
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        redisTemplate = new StringRedisTemplate(connectionFactory);
        scriptExecutor = new RedisScriptExecutorImpl(redisTemplate);
        client = new RedisSharedStateClient(scriptExecutor, redisTemplate, new StateCodec(), 64, Duration.ofSeconds(2));
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        // 각 테스트 전 Redis 초기화
        redisTemplate.getConnectionFactory()
                .getConnection()
                .serverCommands()
                .flushAll();
    }

    @Test
    @DisplayName("Sliding Window - Redis 시각 기준으로 5번 허용 후 거부")
    void slidingWindowOnRedis() {
        // given
        SlidingWindowStrategy strategy = new SlidingWindowStrategy(client);
        long now = System.currentTimeMillis();
        for (int i = 0; i < 5; i++) {
            assertThat(strategy.check("rate_limit:sliding_window:global:alice", rule, now).isAllowed()).isTrue();
        }

        // when
        RuleCheckResult sixth = strategy.check("rate_limit:sliding_window:global:alice", rule, now);

        // then
        assertThat(sixth.isAllowed()).isFalse();
        assertThat(sixth.getRetryAfterSeconds()).isGreaterThan(0);
        assertThat(redisTemplate.getExpire("rate_limit:sliding_window:global:alice")).isPositive();
    }

    @Test
    @DisplayName("여러 클라이언트가 동시에 접근해도 정확히 한도만큼 허용 (CAS)")
    void concurrentCasAdmitsExactlyLimit() throws Exception {
        // given
        // 윈도우 경계를 넘지 않도록 Sliding Window 사용
        RateLimitRule stress = RateLimitRule.builder()
                .name("stress")
                .algorithm(AlgorithmType.SLIDING_WINDOW)
                .limit(50)
                .windowSizeSeconds(3600)
                .keyPattern("stress:{userId}")
                .build();
        SlidingWindowStrategy strategy = new SlidingWindowStrategy(client);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        // when
        List<Future<Integer>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                int admitted = 0;
                for (int i = 0; i < 20; i++) {
                    if (strategy.check("rate_limit:sliding_window:stress:bob", stress, System.currentTimeMillis()).isAllowed()) {
                        admitted++;
                    }
                }
                return admitted;
            }));
        }
        start.countDown();
        int total = 0;
        for (Future<Integer> future : futures) {
            total += future.get(60, TimeUnit.SECONDS);
        }
        executor.shutdownNow();

        // then
        assertThat(total).isEqualTo(50);
    }

    @Test
    @DisplayName("마커 저장, TTL 조회, 삭제")
    void markersAndDelete() {
        // given
        client.put("admission:block:user:a", "risk", Duration.ofMinutes(15));
        client.put("admission:block:ip:10.0.0.1", "risk", Duration.ofMinutes(15));

        // when
        Optional<Duration> ttl = client.remainingTtl("admission:block:user:a");
        client.delete("admission:block:user:a", "admission:block:ip:10.0.0.1");

        // then
        assertThat(ttl).isPresent();
        assertThat(ttl.get()).isGreaterThan(Duration.ofMinutes(14));
        assertThat(client.get("admission:block:user:a")).isEmpty();
        assertThat(client.remainingTtl("admission:block:ip:10.0.0.1")).isEmpty();
    }
}
