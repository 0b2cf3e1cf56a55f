package com.example.admission.config;

import com.example.admission.application.metrics.AdmissionMetricsRecorder;
import com.example.admission.application.service.AbuseMonitor;
import com.example.admission.common.exception.RuleConfigurationException;
import com.example.admission.domain.abuse.AbuseActionPolicy;
import com.example.admission.domain.abuse.AbuseDetectionEngine;
import com.example.admission.domain.abuse.AbuseDetector;
import com.example.admission.domain.abuse.detector.CoordinatedAttackDetector;
import com.example.admission.domain.abuse.detector.CredentialStuffingDetector;
import com.example.admission.domain.abuse.detector.EnumerationDetector;
import com.example.admission.domain.abuse.detector.GeoAnomalyDetector;
import com.example.admission.domain.abuse.detector.RateSpikeDetector;
import com.example.admission.domain.abuse.detector.ScrapingDetector;
import com.example.admission.domain.abuse.detector.UserAgentAnomalyDetector;
import com.example.admission.domain.adaptive.AdaptiveLimitAdjuster;
import com.example.admission.domain.behavior.BehaviorAnalyzer;
import com.example.admission.domain.behavior.BehaviorHistoryStore;
import com.example.admission.domain.behavior.BehaviorProfileCalculator;
import com.example.admission.domain.behavior.IdentityDirectory;
import com.example.admission.domain.behavior.InMemoryIdentityDirectory;
import com.example.admission.domain.model.RateLimitRule;
import com.example.admission.domain.response.EnforcementStore;
import com.example.admission.domain.response.ResponseManager;
import com.example.admission.domain.rule.RuleRegistry;
import com.example.admission.domain.rule.RuleResolver;
import com.example.admission.domain.rule.RuleSetCodec;
import com.example.admission.domain.rule.RuleValidator;
import com.example.admission.infrastructure.redis.RedisScriptExecutorImpl;
import com.example.admission.infrastructure.redis.RedisSharedStateClient;
import com.example.admission.infrastructure.store.InMemorySharedStateClient;
import com.example.admission.infrastructure.store.SharedStateClient;
import com.example.admission.infrastructure.store.StateCodec;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.List;

/**
 * 입장 제어 컴포넌트 조립
 *
 * 도메인 클래스는 스프링에 의존하지 않으므로 여기서 설정값과 함께 생성한다.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AdmissionConfig {

    private final AdmissionProperties properties;
    private final AbuseDetectionProperties abuseProperties;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StateCodec stateCodec() {
        return new StateCodec();
    }

    @Bean
    public SharedStateClient sharedStateClient(StateCodec stateCodec,
                                               Clock clock,
                                               ObjectProvider<StringRedisTemplate> redisTemplate) {
        AdmissionProperties.Store store = properties.getStore();
        log.info("Shared state store: {}", store.getType());
        return switch (store.getType()) {
            case REDIS -> {
                StringRedisTemplate template = redisTemplate.getObject();
                yield new RedisSharedStateClient(new RedisScriptExecutorImpl(template), template, stateCodec,
                        store.getMaxCasAttempts(), store.getMaxClockSkew());
            }
            case IN_MEMORY -> new InMemorySharedStateClient(stateCodec, clock);
        };
    }

    // ===== 규칙 =====

    @Bean
    public RuleSetCodec ruleSetCodec() {
        return new RuleSetCodec();
    }

    @Bean
    public RuleRegistry ruleRegistry(Clock clock) {
        RuleRegistry registry = new RuleRegistry(new RuleValidator(), clock);
        List<RateLimitRule> rules;
        try {
            rules = properties.toRules();
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException("Invalid admission.rules: " + e.getMessage(), e);
        }
        registry.reload(rules);
        return registry;
    }

    @Bean
    public EnforcementStore enforcementStore(SharedStateClient sharedStateClient) {
        return new EnforcementStore(sharedStateClient);
    }

    @Bean
    public AdaptiveLimitAdjuster adaptiveLimitAdjuster(EnforcementStore enforcementStore) {
        return new AdaptiveLimitAdjuster(properties.getAdaptive(), properties.getEnforcement(), enforcementStore);
    }

    @Bean
    public RuleResolver ruleResolver(RuleRegistry ruleRegistry, AdaptiveLimitAdjuster adaptiveLimitAdjuster) {
        return new RuleResolver(ruleRegistry, adaptiveLimitAdjuster);
    }

    // ===== 행동 분석 =====

    @Bean
    public ThreadPoolTaskExecutor behaviorExecutor() {
        return executor("behavior-", properties.getBehavior().getAnalyzerThreads(), 1_000);
    }

    @Bean
    public BehaviorHistoryStore behaviorHistoryStore(Clock clock) {
        AdmissionProperties.Behavior behavior = properties.getBehavior();
        return new BehaviorHistoryStore(clock, behavior.getHistoryRetention(), behavior.getMaxHistories(),
                behavior.getMaxSamples(), behavior.getMaxDistinctValues());
    }

    @Bean
    @ConditionalOnMissingBean(IdentityDirectory.class)
    public InMemoryIdentityDirectory identityDirectory() {
        return new InMemoryIdentityDirectory();
    }

    @Bean
    public BehaviorAnalyzer behaviorAnalyzer(BehaviorHistoryStore historyStore,
                                             IdentityDirectory identityDirectory,
                                             Clock clock) {
        AdmissionProperties.Behavior behavior = properties.getBehavior();
        BehaviorProfileCalculator calculator = new BehaviorProfileCalculator(historyStore, identityDirectory, clock,
                behavior.getFrequentEndpointShare());
        return new BehaviorAnalyzer(calculator, clock, behavior.getProfileTtl(), behavior.getRefreshAfter(),
                behavior.getMaxProfiles(), behaviorExecutor());
    }

    // ===== 오남용 탐지 =====

    @Bean
    public ThreadPoolTaskExecutor detectorExecutor() {
        return executor("detector-", abuseProperties.getThreads(), 10_000);
    }

    @Bean
    public ThreadPoolTaskExecutor abuseAnalysisExecutor() {
        return executor("abuse-analysis-", Math.max(1, abuseProperties.getThreads() / 2), 10_000);
    }

    @Bean
    public AbuseDetectionEngine abuseDetectionEngine(Clock clock) {
        AbuseDetectionProperties abuse = abuseProperties;
        List<AbuseDetector> detectors = List.of(
                new RateSpikeDetector(abuse.getRateSpike(), abuse.getHistoryTtl(), abuse.getMaxTrackedKeys()),
                new GeoAnomalyDetector(abuse.getGeo(), abuse.getHistoryTtl(), abuse.getMaxTrackedKeys()),
                new UserAgentAnomalyDetector(abuse.getUserAgent(), abuse.getHistoryTtl(), abuse.getMaxTrackedKeys()),
                new EnumerationDetector(abuse.getEnumeration(), abuse.getHistoryTtl(), abuse.getMaxTrackedKeys()),
                new CredentialStuffingDetector(abuse.getCredentialStuffing(), abuse.getHistoryTtl(), abuse.getMaxTrackedKeys()),
                new ScrapingDetector(abuse.getScraping(), abuse.getHistoryTtl(), abuse.getMaxTrackedKeys()),
                new CoordinatedAttackDetector(abuse.getCoordinated(), abuse.getHistoryTtl(), abuse.getMaxTrackedKeys()));
        return new AbuseDetectionEngine(detectors, new AbuseActionPolicy(), detectorExecutor(), clock,
                abuse.getDetectorTimeout(), abuse.getAnalysisDeadline());
    }

    @Bean
    public ResponseManager responseManager(EnforcementStore enforcementStore, MeterRegistry meterRegistry) {
        return new ResponseManager(enforcementStore, properties.getEnforcement(), meterRegistry);
    }

    @Bean
    public AbuseMonitor abuseMonitor(AbuseDetectionEngine abuseDetectionEngine, ResponseManager responseManager) {
        return new AbuseMonitor(abuseDetectionEngine, responseManager, abuseAnalysisExecutor(), abuseProperties.isEnabled());
    }

    // ===== 메트릭 =====

    @Bean
    public AdmissionMetricsRecorder admissionMetricsRecorder(MeterRegistry meterRegistry,
                                                             Clock clock,
                                                             BehaviorHistoryStore historyStore,
                                                             BehaviorAnalyzer behaviorAnalyzer) {
        AdmissionProperties.Metrics metrics = properties.getMetrics();
        return new AdmissionMetricsRecorder(meterRegistry, clock, historyStore, behaviorAnalyzer,
                metrics.getViolationRetention(), metrics.getMaxViolations());
    }

    /**
     * 대기열이 가득 차면 RejectedExecutionException. 호출 측은 작업을 건너뛴다.
     */
    private static ThreadPoolTaskExecutor executor(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
