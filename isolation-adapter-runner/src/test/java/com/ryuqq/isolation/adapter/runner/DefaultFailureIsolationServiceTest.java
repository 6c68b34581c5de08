package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.adapter.inmemory.event.InMemoryBreakerEventChannel;
import com.ryuqq.isolation.adapter.inmemory.persistence.InMemoryBreakerPersistence;
import com.ryuqq.isolation.adapter.inmemory.store.InMemoryBreakerStore;
import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.config.BreakerFeatures;
import com.ryuqq.isolation.core.config.DetectionPolicy;
import com.ryuqq.isolation.core.decision.AdmissionDecision;
import com.ryuqq.isolation.core.decision.DecisionReason;
import com.ryuqq.isolation.core.decision.FallbackHint;
import com.ryuqq.isolation.core.detector.AnomalyModel;
import com.ryuqq.isolation.core.detector.StrategyFailureDetector;
import com.ryuqq.isolation.core.event.CoordinationEvent;
import com.ryuqq.isolation.core.event.StateTransitionEvent;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.model.BusinessImpactTier;
import com.ryuqq.isolation.core.model.DetectionStrategy;
import com.ryuqq.isolation.core.model.ErrorContext;
import com.ryuqq.isolation.core.model.RequestContext;
import com.ryuqq.isolation.core.model.SystemLayer;
import com.ryuqq.isolation.core.spi.BreakerNotFoundException;
import com.ryuqq.isolation.core.spi.BreakerPersistence;
import com.ryuqq.isolation.core.spi.PersistedBreaker;
import com.ryuqq.isolation.core.statemachine.StateTransition;
import com.ryuqq.isolation.core.statemachine.TransitionSignal;
import com.ryuqq.isolation.core.status.StatusSummary;
import com.ryuqq.isolation.testkit.fixture.BreakerFixtures;
import com.ryuqq.isolation.testkit.time.ManualTaskScheduler;
import com.ryuqq.isolation.testkit.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * DefaultFailureIsolationService 통합 테스트.
 *
 * <p>인메모리 저장소, 가상 시계, 수동 스케줄러로 판정/기록/운영자 제어 흐름을 검증합니다:</p>
 * <ul>
 *   <li>CLOSED → OPEN → HALF_OPEN → CLOSED 수명주기</li>
 *   <li>HALF_OPEN probe 한도와 실패 시 재차단</li>
 *   <li>FORCE_OPEN 자동 해제 및 재설정</li>
 *   <li>긴급 에스컬레이션과 비즈니스 우회</li>
 *   <li>트립 시 계층 간 격리 조정</li>
 *   <li>영속 상태 복원</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DefaultFailureIsolationServiceTest {

    private static final BreakerId PAYMENT = BreakerId.of("payment-api");

    private MutableClock clock;
    private ManualTaskScheduler scheduler;
    private InMemoryBreakerStore store;
    private InMemoryBreakerEventChannel channel;
    private InMemoryBreakerPersistence persistence;
    private ChangeDispatcher dispatcher;
    private ExecutorService isolationExecutor;
    private DefaultCoordinationOrchestrator orchestrator;
    private DefaultFailureIsolationService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T09:00:00Z");
        scheduler = new ManualTaskScheduler(clock);
        store = new InMemoryBreakerStore(clock, 100);
        channel = new InMemoryBreakerEventChannel();
        persistence = new InMemoryBreakerPersistence();
        dispatcher = new ChangeDispatcher(channel, persistence);
        isolationExecutor = Executors.newFixedThreadPool(4);
        orchestrator = new DefaultCoordinationOrchestrator(
            store, dispatcher, scheduler, isolationExecutor, clock, new CoordinatorConfig()
        );
        service = newService(new IsolationSettings());
    }

    @AfterEach
    void tearDown() {
        isolationExecutor.shutdownNow();
    }

    private DefaultFailureIsolationService newService(IsolationSettings settings) {
        return new DefaultFailureIsolationService(
            store,
            new GuardedFailureDetector(new StrategyFailureDetector()),
            orchestrator,
            dispatcher,
            scheduler,
            Runnable::run,
            clock,
            settings
        );
    }

    private void recordOutcomes(BreakerId breakerId, int failures, int successes) {
        for (int i = 0; i < failures; i++) {
            service.recordFailure(breakerId, ErrorContext.unclassified());
        }
        for (int i = 0; i < successes; i++) {
            service.recordSuccess(breakerId, Duration.ofMillis(20));
        }
    }

    private void trip(BreakerId breakerId) {
        recordOutcomes(breakerId, 5, 5);
        AdmissionDecision decision = service.shouldAllowRequest(breakerId);
        assertThat(decision.state()).isEqualTo(BreakerState.OPEN);
    }

    private MetricsSnapshot metricsOf(BreakerId breakerId) {
        return service.getStatus(breakerId).metrics();
    }

    private BreakerId registerWithFailingAnomalyModel() {
        AnomalyModel model = mock(AnomalyModel.class);
        when(model.name()).thenReturn("traffic-model");
        when(model.evaluate(any(), any())).thenThrow(new IllegalStateException("model down"));
        service = new DefaultFailureIsolationService(
            store, new StrategyFailureDetector(model), orchestrator, dispatcher,
            scheduler, Runnable::run, clock, new IsolationSettings()
        );
        service.register(BreakerFixtures.builder("recommend-api", SystemLayer.API)
            .detection(new DetectionPolicy(DetectionStrategy.ANOMALY_BASED, 0.5, 10, Duration.ofSeconds(60), 6))
            .build());
        return BreakerId.of("recommend-api");
    }

    // ============================================================
    // 1. CLOSED 판정과 트립
    // ============================================================

    @Test
    void shouldAllowRequest_표본_부족이면_CLOSED로_허용() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        recordOutcomes(PAYMENT, 4, 0);

        // when
        AdmissionDecision decision = service.shouldAllowRequest(PAYMENT);

        // then
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.state()).isEqualTo(BreakerState.CLOSED);
        assertThat(decision.reason()).isEqualTo(DecisionReason.CLOSED);
        assertThat(decision.confidence()).isEqualTo(0.95);
        assertThat(decision.failureRate()).isEqualTo(1.0);
        assertThat(decision.threshold()).isEqualTo(0.5);
        assertThat(decision.impactTier()).isEqualTo(BusinessImpactTier.MEDIUM);
    }

    @Test
    void shouldAllowRequest_실패율이_임계값에_도달하면_OPEN으로_전이하고_거부() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        recordOutcomes(PAYMENT, 5, 5);
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.CLOSED);
        Instant trippedAt = clock.instant();

        // when
        AdmissionDecision decision = service.shouldAllowRequest(PAYMENT);

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.state()).isEqualTo(BreakerState.OPEN);
        assertThat(decision.reason()).isEqualTo(DecisionReason.OPEN);
        assertThat(decision.estimatedRecoveryAt()).contains(trippedAt.plus(BreakerFixtures.OPEN_DURATION));
        assertThat(decision.fallbackHint()).contains(FallbackHint.RETRY_AFTER_RECOVERY);
        assertThat(decision.confidence()).isEqualTo(0.9);
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.OPEN);
    }

    @Test
    void shouldAllowRequest_openDuration_이전에는_계속_거부() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        trip(PAYMENT);

        // when
        clock.advance(Duration.ofSeconds(29));
        AdmissionDecision decision = service.shouldAllowRequest(PAYMENT);

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.state()).isEqualTo(BreakerState.OPEN);
    }

    @Test
    void recordFailure_최소_표본에서_임계값_도달시_즉시_OPEN() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        recordOutcomes(PAYMENT, 0, 5);

        // when
        recordOutcomes(PAYMENT, 5, 0);

        // then
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.OPEN);
    }

    @Test
    void shouldAllowRequest_반복_호출은_카운터와_상태를_바꾸지_않음() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        recordOutcomes(PAYMENT, 3, 4);
        MetricsSnapshot before = metricsOf(PAYMENT);

        // when
        for (int i = 0; i < 20; i++) {
            service.shouldAllowRequest(PAYMENT);
        }

        // then
        MetricsSnapshot after = metricsOf(PAYMENT);
        assertThat(after.state()).isEqualTo(before.state());
        assertThat(after.failureCount()).isEqualTo(before.failureCount());
        assertThat(after.successCount()).isEqualTo(before.successCount());
    }

    @Test
    void recordFailure_감지기_예외는_전파하지_않고_OPEN으로_전이() {
        // given
        BreakerId breakerId = registerWithFailingAnomalyModel();
        recordOutcomes(breakerId, 0, 9);

        // when & then
        assertThatCode(() -> service.recordFailure(breakerId, ErrorContext.unclassified()))
            .doesNotThrowAnyException();
        assertThat(metricsOf(breakerId).state()).isEqualTo(BreakerState.OPEN);
        assertThat(metricsOf(breakerId).failureCount()).isEqualTo(1);

        StateTransitionEvent event = channel.eventsOf(StateTransitionEvent.class).get(0);
        assertThat(event.transition().signal()).isEqualTo(TransitionSignal.THRESHOLD_BREACHED);
        assertThat(event.transition().reason()).startsWith("Detector failure");
    }

    @Test
    void shouldAllowRequest_감지기_예외는_전파하지_않고_거부() {
        // given
        BreakerId breakerId = registerWithFailingAnomalyModel();
        recordOutcomes(breakerId, 0, 10);

        // when
        AdmissionDecision decision = service.shouldAllowRequest(breakerId);

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.state()).isEqualTo(BreakerState.OPEN);
        assertThat(metricsOf(breakerId).state()).isEqualTo(BreakerState.OPEN);
    }

    // ============================================================
    // 2. OPEN → HALF_OPEN → CLOSED
    // ============================================================

    @Test
    void shouldAllowRequest_openDuration_경과후_첫_호출이_HALF_OPEN_전이() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        trip(PAYMENT);
        clock.advance(BreakerFixtures.OPEN_DURATION);
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.OPEN);

        // when
        AdmissionDecision decision = service.shouldAllowRequest(PAYMENT);

        // then
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.state()).isEqualTo(BreakerState.HALF_OPEN);
        assertThat(decision.reason()).isEqualTo(DecisionReason.HALF_OPEN_PROBE);
        assertThat(decision.confidence()).isEqualTo(0.7);
        assertThat(metricsOf(PAYMENT).probesIssued()).isEqualTo(1);
    }

    @Test
    void shouldAllowRequest_probe_한도_초과시_거부() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        trip(PAYMENT);
        clock.advance(BreakerFixtures.OPEN_DURATION);

        // when
        List<Boolean> admitted = List.of(
            service.shouldAllowRequest(PAYMENT).allowed(),
            service.shouldAllowRequest(PAYMENT).allowed(),
            service.shouldAllowRequest(PAYMENT).allowed()
        );
        AdmissionDecision fourth = service.shouldAllowRequest(PAYMENT);

        // then
        assertThat(admitted).containsOnly(true);
        assertThat(fourth.allowed()).isFalse();
        assertThat(fourth.reason()).isEqualTo(DecisionReason.HALF_OPEN_QUOTA_EXHAUSTED);
    }

    @Test
    void recordSuccess_HALF_OPEN에서_연속_성공시_CLOSED로_전이하고_카운터_초기화() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        trip(PAYMENT);
        clock.advance(BreakerFixtures.OPEN_DURATION);
        service.shouldAllowRequest(PAYMENT);

        // when
        service.recordSuccess(PAYMENT, Duration.ofMillis(15));
        service.recordSuccess(PAYMENT, Duration.ofMillis(15));
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.HALF_OPEN);
        service.recordSuccess(PAYMENT, Duration.ofMillis(15));

        // then
        MetricsSnapshot metrics = metricsOf(PAYMENT);
        assertThat(metrics.state()).isEqualTo(BreakerState.CLOSED);
        assertThat(metrics.failureCount()).isZero();
        assertThat(metrics.successCount()).isZero();
        assertThat(metrics.consecutiveSuccesses()).isZero();
        assertThat(metrics.probesIssued()).isZero();
    }

    @Test
    void recordFailure_HALF_OPEN에서_실패하면_OPEN으로_돌아가고_시계_재시작() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        trip(PAYMENT);
        clock.advance(BreakerFixtures.OPEN_DURATION);
        service.shouldAllowRequest(PAYMENT);
        service.recordSuccess(PAYMENT, Duration.ofMillis(10));
        clock.advance(Duration.ofSeconds(5));
        Instant failedAt = clock.instant();

        // when
        service.recordFailure(PAYMENT, ErrorContext.unclassified());

        // then
        MetricsSnapshot metrics = metricsOf(PAYMENT);
        assertThat(metrics.state()).isEqualTo(BreakerState.OPEN);
        assertThat(metrics.stateEnteredAt()).isEqualTo(failedAt);
        AdmissionDecision decision = service.shouldAllowRequest(PAYMENT);
        assertThat(decision.estimatedRecoveryAt()).contains(failedAt.plus(BreakerFixtures.OPEN_DURATION));
    }

    // ============================================================
    // 3. 비즈니스 우회
    // ============================================================

    @Test
    void shouldAllowRequest_OPEN에서_매출_영향_요청은_비즈니스_우회로_허용() {
        // given
        BreakerConfig config = BreakerFixtures.builder("payment-api", SystemLayer.API)
            .features(new BreakerFeatures().withBusinessAwareBreaking(true))
            .build();
        service.register(config);
        trip(PAYMENT);

        // when
        AdmissionDecision decision = service.shouldAllowRequest(
            PAYMENT, RequestContext.revenueImpacting(BusinessImpactTier.HIGH));

        // then
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.state()).isEqualTo(BreakerState.OPEN);
        assertThat(decision.reason()).isEqualTo(DecisionReason.OPEN_BUSINESS_OVERRIDE);
        assertThat(decision.confidence()).isEqualTo(0.8);
        assertThat(decision.impactTier()).isEqualTo(BusinessImpactTier.HIGH);
        assertThat(decision.fallbackHint()).contains(FallbackHint.USE_CACHED_OR_ALTERNATE_PATH);
    }

    @Test
    void shouldAllowRequest_비즈니스_우회가_비활성화되면_거부() {
        // given
        BreakerConfig config = BreakerFixtures.builder("payment-api", SystemLayer.API)
            .features(new BreakerFeatures().withBusinessAwareBreaking(true))
            .build();
        service = newService(new IsolationSettings().withBusinessOverrideEnabled(false));
        service.register(config);
        trip(PAYMENT);

        // when
        AdmissionDecision decision = service.shouldAllowRequest(
            PAYMENT, RequestContext.revenueImpacting(BusinessImpactTier.HIGH));

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(DecisionReason.OPEN);
    }

    // ============================================================
    // 4. FORCE_OPEN
    // ============================================================

    @Test
    void forceOpen_성공_기록과_무관하게_항상_거부() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        service.forceOpen(PAYMENT, "maintenance window", null);

        // when
        recordOutcomes(PAYMENT, 0, 20);
        AdmissionDecision decision = service.shouldAllowRequest(PAYMENT);

        // then
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.state()).isEqualTo(BreakerState.FORCE_OPEN);
        assertThat(decision.reason()).isEqualTo(DecisionReason.FORCED_OPEN);
        assertThat(decision.fallbackHint()).contains(FallbackHint.CONTACT_OPERATOR);
        assertThat(decision.confidence()).isEqualTo(1.0);
    }

    @Test
    void revert_FORCE_OPEN을_CLOSED로_되돌림() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        service.forceOpen(PAYMENT, "maintenance window", null);

        // when
        service.revert(PAYMENT);

        // then
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.CLOSED);
        assertThat(service.shouldAllowRequest(PAYMENT).allowed()).isTrue();
    }

    @Test
    void forceOpen_지정_시간이_지나면_자동_해제() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        service.forceOpen(PAYMENT, "deploy", Duration.ofMinutes(1));

        // when
        scheduler.advance(Duration.ofSeconds(59));
        BreakerState beforeExpiry = metricsOf(PAYMENT).state();
        scheduler.advance(Duration.ofSeconds(1));

        // then
        assertThat(beforeExpiry).isEqualTo(BreakerState.FORCE_OPEN);
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.CLOSED);
        assertThat(metricsOf(PAYMENT).history())
            .extracting(StateTransition::signal)
            .endsWith(TransitionSignal.FORCE_OPEN_EXPIRED);
    }

    @Test
    void forceOpen_다시_호출하면_이전_자동_해제를_취소() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        service.forceOpen(PAYMENT, "deploy", Duration.ofMinutes(1));
        scheduler.advance(Duration.ofSeconds(30));

        // when
        service.forceOpen(PAYMENT, "extended deploy", Duration.ofMinutes(5));
        scheduler.advance(Duration.ofSeconds(40));

        // then
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.FORCE_OPEN);
        scheduler.advance(Duration.ofMinutes(5));
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.CLOSED);
    }

    @Test
    void revert_이후에는_자동_해제_예약이_남지_않음() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        service.forceOpen(PAYMENT, "deploy", Duration.ofMinutes(1));

        // when
        service.revert(PAYMENT);

        // then
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void forceOpen_양수가_아닌_자동_해제_시간은_거부() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));

        // when & then
        assertThatThrownBy(() -> service.forceOpen(PAYMENT, "deploy", Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("autoRevertAfter must be positive");
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.CLOSED);
    }

    // ============================================================
    // 5. 긴급 에스컬레이션
    // ============================================================

    @Test
    void recordFailure_에스컬레이션_등급_이상이면_EMERGENCY로_전이() {
        // given
        BreakerConfig config = BreakerFixtures.builder("payment-api", SystemLayer.API)
            .features(new BreakerFeatures().withEmergencyEscalation(BusinessImpactTier.CRITICAL))
            .build();
        service.register(config);

        // when
        service.recordFailure(PAYMENT, ErrorContext.of(BusinessImpactTier.HIGH));
        BreakerState afterHigh = metricsOf(PAYMENT).state();
        service.recordFailure(PAYMENT, ErrorContext.revenueImpacting(BusinessImpactTier.CRITICAL, 1_000.0));

        // then
        assertThat(afterHigh).isEqualTo(BreakerState.CLOSED);
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.EMERGENCY);

        AdmissionDecision decision = service.shouldAllowRequest(PAYMENT);
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(DecisionReason.EMERGENCY_ESCALATION_REQUIRED);
        assertThat(decision.escalationRequired()).isTrue();
        assertThat(decision.fallbackHint()).contains(FallbackHint.ESCALATE);
    }

    @Test
    void recordFailure_등급이_없는_실패는_에스컬레이션하지_않음() {
        // given
        BreakerConfig config = BreakerFixtures.builder("payment-api", SystemLayer.API)
            .features(new BreakerFeatures().withEmergencyEscalation(BusinessImpactTier.MINIMAL))
            .build();
        service.register(config);

        // when
        service.recordFailure(PAYMENT, ErrorContext.unclassified());

        // then
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.CLOSED);
    }

    @Test
    void resolveEmergency_EMERGENCY를_HALF_OPEN으로_전이() {
        // given
        BreakerConfig config = BreakerFixtures.builder("payment-api", SystemLayer.API)
            .features(new BreakerFeatures().withEmergencyEscalation(BusinessImpactTier.CRITICAL))
            .build();
        service.register(config);
        service.recordFailure(PAYMENT, ErrorContext.of(BusinessImpactTier.REVENUE_BLOCKING));

        // when
        service.resolveEmergency(PAYMENT, "database failover completed");

        // then
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.HALF_OPEN);
        assertThat(service.shouldAllowRequest(PAYMENT).reason()).isEqualTo(DecisionReason.HALF_OPEN_PROBE);
    }

    @Test
    void resolveEmergency_EMERGENCY가_아니면_예외() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));

        // when & then
        assertThatThrownBy(() -> service.resolveEmergency(PAYMENT, "nothing to resolve"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Invalid state transition");
    }

    // ============================================================
    // 6. reset / 비즈니스 영향
    // ============================================================

    @Test
    void reset_상태와_누적_영향을_초기화() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        service.recordFailure(PAYMENT, ErrorContext.revenueImpacting(BusinessImpactTier.HIGH, 250.0));
        trip(PAYMENT);
        assertThat(metricsOf(PAYMENT).impact().valueAtRisk()).isEqualTo(250.0);

        // when
        service.reset(PAYMENT);

        // then
        MetricsSnapshot metrics = metricsOf(PAYMENT);
        assertThat(metrics.state()).isEqualTo(BreakerState.CLOSED);
        assertThat(metrics.impact().valueAtRisk()).isZero();
        assertThat(metrics.impact().revenueImpactingFailures()).isZero();
        assertThat(metrics.impact().worstTier()).isEmpty();
    }

    @Test
    void 상태_전이는_HALF_OPEN을_거쳐도_누적_영향을_유지() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        service.recordFailure(PAYMENT, ErrorContext.revenueImpacting(BusinessImpactTier.HIGH, 99.5));
        trip(PAYMENT);

        // when
        clock.advance(BreakerFixtures.OPEN_DURATION);
        service.shouldAllowRequest(PAYMENT);

        // then
        assertThat(metricsOf(PAYMENT).state()).isEqualTo(BreakerState.HALF_OPEN);
        assertThat(metricsOf(PAYMENT).impact().valueAtRisk()).isEqualTo(99.5);
    }

    // ============================================================
    // 7. 이벤트 / 영속화
    // ============================================================

    @Test
    void 전이는_이벤트로_발행되고_상태가_저장됨() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));

        // when
        trip(PAYMENT);

        // then
        List<StateTransitionEvent> events = channel.eventsOf(StateTransitionEvent.class);
        assertThat(events).hasSize(1);
        StateTransitionEvent event = events.get(0);
        assertThat(event.breakerId()).isEqualTo(PAYMENT);
        assertThat(event.layer()).isEqualTo(SystemLayer.API);
        assertThat(event.transition().from()).isEqualTo(BreakerState.CLOSED);
        assertThat(event.transition().to()).isEqualTo(BreakerState.OPEN);
        assertThat(event.transition().signal()).isEqualTo(TransitionSignal.THRESHOLD_BREACHED);
        assertThat(event.transition().trigger().failureCount()).isEqualTo(5);

        assertThat(persistence.loadAll())
            .extracting(PersistedBreaker::state)
            .containsExactly(BreakerState.OPEN);
    }

    @Test
    void 판정만_있고_전이가_없으면_이벤트도_없음() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));

        // when
        service.shouldAllowRequest(PAYMENT);
        service.recordSuccess(PAYMENT, null);

        // then
        assertThat(channel.size()).isZero();
    }

    @Test
    void 동시_전이도_이벤트와_저장_상태는_전이_순서를_따름() throws InterruptedException {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        int threads = 4;
        int iterations = 100;
        ExecutorService workers = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // when
        try {
            for (int t = 0; t < threads; t++) {
                boolean forcing = t % 2 == 0;
                workers.submit(() -> {
                    start.await();
                    for (int i = 0; i < iterations; i++) {
                        if (forcing) {
                            service.forceOpen(PAYMENT, "maintenance", null);
                        } else {
                            service.reset(PAYMENT);
                        }
                    }
                    return null;
                });
            }
            start.countDown();
            workers.shutdown();
            assertThat(workers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            workers.shutdownNow();
        }

        // then
        List<StateTransitionEvent> events = channel.eventsOf(StateTransitionEvent.class);
        assertThat(events).hasSize(threads * iterations);
        for (int i = 1; i < events.size(); i++) {
            assertThat(events.get(i).transition().from()).isEqualTo(events.get(i - 1).transition().to());
        }
        BreakerState live = metricsOf(PAYMENT).state();
        assertThat(events.get(events.size() - 1).transition().to()).isEqualTo(live);
        assertThat(persistence.loadAll())
            .extracting(PersistedBreaker::state)
            .containsExactly(live);
    }

    // ============================================================
    // 8. 계층 간 격리 조정
    // ============================================================

    @Test
    void 트립시_조정_대상_계층의_breaker를_함께_격리() {
        // given
        BreakerConfig trigger = BreakerFixtures.builder("checkout-api", SystemLayer.API)
            .features(new BreakerFeatures().withCoordination(
                Set.of(SystemLayer.DATA_ACCESS, SystemLayer.EXTERNAL_SERVICES)))
            .build();
        service.register(trigger);
        service.register(BreakerFixtures.atLayer("orders-db", SystemLayer.DATA_ACCESS));
        service.register(BreakerFixtures.atLayer("pg-gateway", SystemLayer.EXTERNAL_SERVICES));
        service.register(BreakerFixtures.atLayer("search-api", SystemLayer.API));
        BreakerId checkout = BreakerId.of("checkout-api");

        // when
        trip(checkout);

        // then
        assertThat(metricsOf(BreakerId.of("orders-db")).state()).isEqualTo(BreakerState.OPEN);
        assertThat(metricsOf(BreakerId.of("pg-gateway")).state()).isEqualTo(BreakerState.OPEN);
        assertThat(metricsOf(BreakerId.of("search-api")).state()).isEqualTo(BreakerState.CLOSED);

        List<CoordinationEvent> coordinations = channel.eventsOf(CoordinationEvent.class);
        assertThat(coordinations).hasSize(1);
        assertThat(coordinations.get(0).response().triggerBreakerId()).isEqualTo(checkout);
        assertThat(coordinations.get(0).response().affectedBreakers())
            .containsExactlyInAnyOrder(BreakerId.of("orders-db"), BreakerId.of("pg-gateway"));
    }

    @Test
    void 조정이_비활성화되면_트립해도_다른_계층은_유지() {
        // given
        BreakerConfig trigger = BreakerFixtures.builder("checkout-api", SystemLayer.API)
            .features(new BreakerFeatures().withCoordination(Set.of(SystemLayer.DATA_ACCESS)))
            .build();
        service = newService(new IsolationSettings().withCoordinateOnTrip(false));
        service.register(trigger);
        service.register(BreakerFixtures.atLayer("orders-db", SystemLayer.DATA_ACCESS));

        // when
        trip(BreakerId.of("checkout-api"));

        // then
        assertThat(metricsOf(BreakerId.of("orders-db")).state()).isEqualTo(BreakerState.CLOSED);
        assertThat(channel.eventsOf(CoordinationEvent.class)).isEmpty();
    }

    @Test
    void 트리거가_CLOSED로_돌아오면_복구_모니터를_취소() {
        // given
        BreakerConfig trigger = BreakerFixtures.builder("checkout-api", SystemLayer.API)
            .features(new BreakerFeatures().withCoordination(Set.of(SystemLayer.DATA_ACCESS)))
            .build();
        service.register(trigger);
        service.register(BreakerFixtures.atLayer("orders-db", SystemLayer.DATA_ACCESS));
        BreakerId checkout = BreakerId.of("checkout-api");
        trip(checkout);
        assertThat(scheduler.pendingCount()).isEqualTo(1);

        // when
        service.reset(checkout);

        // then
        assertThat(scheduler.pendingCount()).isZero();
    }

    // ============================================================
    // 9. 등록 / 조회
    // ============================================================

    @Test
    void deregister_이후_조회와_판정은_NotFound() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));

        // when
        service.deregister(PAYMENT);

        // then
        assertThatThrownBy(() -> service.getStatus(PAYMENT))
            .isInstanceOf(BreakerNotFoundException.class);
        assertThatThrownBy(() -> service.shouldAllowRequest(PAYMENT))
            .isInstanceOf(BreakerNotFoundException.class);
        assertThat(persistence.size()).isZero();
    }

    @Test
    void deregister_예약된_자동_해제를_취소() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        service.forceOpen(PAYMENT, "deploy", Duration.ofMinutes(1));

        // when
        service.deregister(PAYMENT);

        // then
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void updateConfig_새_임계값으로_판정() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        recordOutcomes(PAYMENT, 3, 7);
        BreakerConfig stricter = BreakerFixtures.standard("payment-api").toBuilder()
            .detection(BreakerFixtures.standard("payment-api").detection().withFailureThreshold(0.25))
            .build();

        // when
        service.updateConfig(stricter);
        AdmissionDecision decision = service.shouldAllowRequest(PAYMENT);

        // then
        assertThat(decision.state()).isEqualTo(BreakerState.OPEN);
        assertThat(decision.threshold()).isEqualTo(0.25);
    }

    @Test
    void summarize_상태별_집계() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        service.register(BreakerFixtures.standard("search-api"));
        service.register(BreakerFixtures.standard("profile-api"));
        service.forceOpen(BreakerId.of("search-api"), "maintenance", null);
        trip(PAYMENT);

        // when
        StatusSummary summary = service.summarize();

        // then
        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.forcedOpen()).isEqualTo(1);
        assertThat(summary.emergency()).isZero();
        assertThat(service.getAllStatuses()).hasSize(3);
    }

    @Test
    void 등록되지_않은_breaker_판정은_NotFound() {
        assertThatThrownBy(() -> service.shouldAllowRequest(BreakerId.of("unknown")))
            .isInstanceOf(BreakerNotFoundException.class);
        assertThatThrownBy(() -> service.recordFailure(BreakerId.of("unknown"), ErrorContext.unclassified()))
            .isInstanceOf(BreakerNotFoundException.class);
    }

    // ============================================================
    // 10. 복원
    // ============================================================

    @Test
    void restore_영속_상태를_복원하고_OPEN은_복원_시각부터_다시_셈() {
        // given
        persistence.saveConfig(BreakerFixtures.standard("payment-api"));
        persistence.saveState(PAYMENT, BreakerState.OPEN);
        persistence.saveConfig(BreakerFixtures.standard("search-api"));
        Instant restoredAt = clock.instant();

        // when
        int restored = service.restore();

        // then
        assertThat(restored).isEqualTo(2);
        MetricsSnapshot payment = metricsOf(PAYMENT);
        assertThat(payment.state()).isEqualTo(BreakerState.OPEN);
        assertThat(payment.stateEnteredAt()).isEqualTo(restoredAt);
        assertThat(metricsOf(BreakerId.of("search-api")).state()).isEqualTo(BreakerState.CLOSED);
        assertThat(service.shouldAllowRequest(PAYMENT).allowed()).isFalse();
    }

    @Test
    void restore_이미_등록된_breaker는_설정을_덮어쓰지_않음() {
        // given
        service.register(BreakerFixtures.standard("payment-api"));
        BreakerConfig persisted = BreakerFixtures.standard("payment-api").toBuilder().name("stale name").build();
        persistence.saveConfig(persisted);

        // when
        service.restore();

        // then
        assertThat(service.getStatus(PAYMENT).config().name()).isEqualTo("payment-api breaker");
    }

    @Test
    void restore_영속_저장소_실패시_0건으로_계속() {
        // given
        BreakerPersistence failing = mock(BreakerPersistence.class);
        when(failing.loadAll()).thenThrow(new IllegalStateException("persistence unavailable"));
        dispatcher = new ChangeDispatcher(channel, failing);
        service = newService(new IsolationSettings());

        // when
        int restored = service.restore();

        // then
        assertThat(restored).isZero();
        assertThat(store.size()).isZero();
    }
}
