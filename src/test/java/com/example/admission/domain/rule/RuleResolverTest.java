package com.example.admission.domain.rule;

import com.example.admission.domain.model.AlgorithmType;
import com.example.admission.domain.model.RateLimitRequest;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.model.RuleScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 규칙 해석 순서, 매칭, 저장소 키 테스트
 */
class RuleResolverTest {

    private RuleRegistry registry;
    private List<RateLimitRule> dynamicRules;
    private RuleResolver resolver;

    private static RateLimitRule.RateLimitRuleBuilder rule(String name, String keyPattern) {
        return RateLimitRule.builder()
                .name(name)
                .algorithm(AlgorithmType.SLIDING_WINDOW)
                .limit(10)
                .windowSizeSeconds(60)
                .keyPattern(keyPattern);
    }

    @BeforeEach
    void setUp() {
        registry = new RuleRegistry(new RuleValidator(), Clock.systemUTC());
        dynamicRules = List.of();
        resolver = new RuleResolver(registry, request -> dynamicRules);
    }

    @Test
    @DisplayName("GLOBAL → ENDPOINT → TIER → IP → DYNAMIC 순서")
    void ordersByScope() {
        // given - 선언 순서를 일부러 뒤섞음
        registry.reload(List.of(
                rule("ip", "ip:{ip}").scope(RuleScope.IP).match("10.0.0.0/8").build(),
                rule("tier", "tier:{userId}").scope(RuleScope.TIER).match("free").build(),
                rule("endpoint", "ep:{userId}:{endpoint}").scope(RuleScope.ENDPOINT).match("/api/orders/**").build(),
                rule("global", "g:{userId}").build()));
        dynamicRules = List.of(rule("dynamic", "throttle:{userId}:{ip}").scope(RuleScope.DYNAMIC).build());

        RateLimitRequest request = RateLimitRequest.builder()
                .userId("alice").ip("10.1.2.3").endpoint("/api/orders/42?expand=true").method("GET").tier("free")
                .build();

        // when
        List<ResolvedRule> resolved = resolver.resolve(request);

        // then
        assertThat(resolved).extracting(r -> r.getRule().getName())
                .containsExactly("global", "endpoint", "tier", "ip", "dynamic");
        assertThat(resolved).extracting(ResolvedRule::getStoreKey).containsExactly(
                "rate_limit:sliding_window:g:alice",
                "rate_limit:sliding_window:ep:alice:/api/orders/42",
                "rate_limit:sliding_window:tier:alice",
                "rate_limit:sliding_window:ip:8e099943f7370d7e",
                "rate_limit:sliding_window:throttle:alice:8e099943f7370d7e");
    }

    @Test
    @DisplayName("엔드포인트 메서드 필터와 티어 기본값")
    void methodFilterAndDefaultTier() {
        // given
        registry.reload(List.of(
                rule("login", "login:{ip}").scope(RuleScope.ENDPOINT).match("/api/auth/login").method("POST").build(),
                rule("default-tier", "t:{tier}").scope(RuleScope.TIER).match("default").build()));

        // when
        List<ResolvedRule> get = resolver.resolve(RateLimitRequest.builder()
                .ip("1.2.3.4").endpoint("/api/auth/login").method("GET").build());
        List<ResolvedRule> post = resolver.resolve(RateLimitRequest.builder()
                .ip("1.2.3.4").endpoint("/api/auth/login").method("post").build());

        // then
        assertThat(get).extracting(r -> r.getRule().getName()).containsExactly("default-tier");
        assertThat(post).extracting(r -> r.getRule().getName()).containsExactly("login", "default-tier");
        assertThat(post.get(1).getStoreKey()).isEqualTo("rate_limit:sliding_window:t:default");
    }

    @Test
    @DisplayName("같은 저장소 키로 해석되는 규칙은 먼저 나온 것만 평가")
    void deduplicatesByStoreKey() {
        // given
        registry.reload(List.of(
                rule("first", "shared:{userId}").build(),
                rule("second", "shared:{userId}").build()));

        // when
        List<ResolvedRule> resolved = resolver.resolve(RateLimitRequest.builder().userId("bob").build());

        // then
        assertThat(resolved).extracting(r -> r.getRule().getName()).containsExactly("first");
    }

    @Test
    @DisplayName("규칙이 없으면 빈 목록")
    void noRules() {
        assertThat(resolver.resolve(RateLimitRequest.builder().ip("1.1.1.1").build())).isEmpty();
    }
}
