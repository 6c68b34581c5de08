package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.application.coordination.CoordinationOrchestrator;
import com.ryuqq.isolation.application.facade.FailureIsolation;
import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.config.BreakerFeatures;
import com.ryuqq.isolation.core.decision.AdmissionDecision;
import com.ryuqq.isolation.core.decision.DecisionReason;
import com.ryuqq.isolation.core.decision.FallbackHint;
import com.ryuqq.isolation.core.detector.DetectionResult;
import com.ryuqq.isolation.core.detector.FailureDetector;
import com.ryuqq.isolation.core.detector.Thresholds;
import com.ryuqq.isolation.core.metrics.BreakerMetrics;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.model.BusinessImpactTier;
import com.ryuqq.isolation.core.model.ErrorContext;
import com.ryuqq.isolation.core.model.RequestContext;
import com.ryuqq.isolation.core.spi.BreakerNotFoundException;
import com.ryuqq.isolation.core.spi.BreakerStore;
import com.ryuqq.isolation.core.spi.BreakerView;
import com.ryuqq.isolation.core.spi.PersistedBreaker;
import com.ryuqq.isolation.core.spi.ScheduledTask;
import com.ryuqq.isolation.core.spi.TaskScheduler;
import com.ryuqq.isolation.core.statemachine.StateTransition;
import com.ryuqq.isolation.core.statemachine.TransitionSignal;
import com.ryuqq.isolation.core.status.BreakerStatus;
import com.ryuqq.isolation.core.status.StatusSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * 요청 허용 판정, 결과 기록, 운영자 제어를 제공하는 기본 구현.
 *
 * <p><strong>처리 흐름 (모든 변경 연산 공통):</strong></p>
 * <pre>
 * 1. store.update(id, ...) → breaker 락 안에서 지표 갱신, 상태 전이, ChangeDispatcher 대기열 추가
 * 2. 락 해제 후 ChangeDispatcher.flush → 전이 순서대로 로그, StateTransitionEvent 발행, 상태 저장
 * 3. 전이마다:
 *    a. CLOSED 진입 → 이 breaker가 시작한 복구 모니터 취소
 *    b. FORCE_OPEN 이탈 → 자동 해제 예약 취소
 *    c. THRESHOLD_BREACHED / EMERGENCY_ESCALATION → 계층 간 격리 조정 (coordinationExecutor)
 * </pre>
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ul>
 *   <li>CLOSED: 감지기 재평가, 통과 시 허용 (confidence 0.95)</li>
 *   <li>OPEN: openDuration 경과 시 HALF_OPEN 전이 후 probe 판정,
 *       아니면 비즈니스 우회 (0.8) 또는 거부 (0.9)</li>
 *   <li>HALF_OPEN: probe 한도 안에서 허용 (0.7), 초과 시 거부 (0.9)</li>
 *   <li>FORCE_OPEN / EMERGENCY: 항상 거부 (1.0)</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 같은 breaker에 대한 연산은 저장소의 breaker별 락으로 직렬화되고,
 * 서로 다른 breaker는 서로를 기다리지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultFailureIsolationService implements FailureIsolation {

    private static final Logger log = LoggerFactory.getLogger(DefaultFailureIsolationService.class);

    private static final double CONFIDENCE_CLOSED = 0.95;
    private static final double CONFIDENCE_BUSINESS_OVERRIDE = 0.8;
    private static final double CONFIDENCE_PROBE = 0.7;
    private static final double CONFIDENCE_DENY = 0.9;
    private static final double CONFIDENCE_OPERATOR = 1.0;

    private final BreakerStore store;
    private final FailureDetector detector;
    private final CoordinationOrchestrator orchestrator;
    private final ChangeDispatcher dispatcher;
    private final TaskScheduler scheduler;
    private final Executor coordinationExecutor;
    private final Clock clock;
    private final IsolationSettings settings;
    private final Map<BreakerId, ScheduledTask> forceOpenExpiries = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param store breaker 저장소
     * @param detector 실패 감지기 ({@link GuardedFailureDetector}로 감싸서 사용)
     * @param orchestrator 계층 간 격리 조정기
     * @param dispatcher 이벤트/영속화 전파
     * @param scheduler 강제 차단 자동 해제용 스케줄러
     * @param coordinationExecutor 조정 실행용 executor (호출 스레드와 분리)
     * @param clock 시계
     * @param settings 서비스 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultFailureIsolationService(
        BreakerStore store,
        FailureDetector detector,
        CoordinationOrchestrator orchestrator,
        ChangeDispatcher dispatcher,
        TaskScheduler scheduler,
        Executor coordinationExecutor,
        Clock clock,
        IsolationSettings settings
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (detector == null) {
            throw new IllegalArgumentException("detector cannot be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (coordinationExecutor == null) {
            throw new IllegalArgumentException("coordinationExecutor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.store = store;
        this.detector = detector instanceof GuardedFailureDetector ? detector : new GuardedFailureDetector(detector);
        this.orchestrator = orchestrator;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.coordinationExecutor = coordinationExecutor;
        this.clock = clock;
        this.settings = settings;
    }

    // ============================================================
    // 요청 허용 판정
    // ============================================================

    @Override
    public AdmissionDecision shouldAllowRequest(BreakerId breakerId, RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        Instant now = clock.instant();
        return mutate(breakerId, (config, metrics, transitions) -> decide(config, metrics, context, now, transitions));
    }

    private AdmissionDecision decide(
        BreakerConfig config,
        BreakerMetrics metrics,
        RequestContext context,
        Instant now,
        List<StateTransition> transitions
    ) {
        BusinessImpactTier tier = context.tierOr(config.businessImpactTier());
        return switch (metrics.state()) {
            case CLOSED -> decideClosed(config, metrics, context, tier, now, transitions);
            case OPEN -> decideOpen(config, metrics, context, tier, now, transitions);
            case HALF_OPEN -> admitProbe(config, metrics, tier, now);
            case FORCE_OPEN -> operatorDenial(config, metrics, tier, now,
                DecisionReason.FORCED_OPEN,
                "Circuit breaker forced open. Contact system administrator",
                FallbackHint.CONTACT_OPERATOR, false);
            case EMERGENCY -> operatorDenial(config, metrics, tier, now,
                DecisionReason.EMERGENCY_ESCALATION_REQUIRED,
                "Emergency escalation required",
                FallbackHint.ESCALATE, true);
        };
    }

    private AdmissionDecision decideClosed(
        BreakerConfig config,
        BreakerMetrics metrics,
        RequestContext context,
        BusinessImpactTier tier,
        Instant now,
        List<StateTransition> transitions
    ) {
        MetricsSnapshot snapshot = metrics.snapshot(now, config.timing());
        DetectionResult detection = detector.shouldOpen(config, snapshot);
        if (!detection.open()) {
            return new AdmissionDecision(
                true, BreakerState.CLOSED, DecisionReason.CLOSED, "Circuit breaker closed",
                Optional.empty(), Optional.empty(), CONFIDENCE_CLOSED,
                snapshot.failureRate(), Thresholds.effective(config, snapshot), false, tier
            );
        }
        transitions.add(metrics.transition(TransitionSignal.THRESHOLD_BREACHED, now, detection.reason()));
        return decideOpen(config, metrics, context, tier, now, transitions);
    }

    private AdmissionDecision decideOpen(
        BreakerConfig config,
        BreakerMetrics metrics,
        RequestContext context,
        BusinessImpactTier tier,
        Instant now,
        List<StateTransition> transitions
    ) {
        Instant reopensAt = metrics.stateEnteredAt().plus(config.timing().openDuration());
        if (!now.isBefore(reopensAt)) {
            transitions.add(metrics.transition(TransitionSignal.OPEN_TIMEOUT_ELAPSED, now, "Open duration elapsed"));
            return admitProbe(config, metrics, tier, now);
        }

        MetricsSnapshot snapshot = metrics.snapshot(now, config.timing());
        double threshold = Thresholds.effective(config, snapshot);
        if (settings.businessOverrideEnabled()
            && config.features().businessAwareBreaking()
            && context.revenueImpacting()) {
            return new AdmissionDecision(
                true, BreakerState.OPEN, DecisionReason.OPEN_BUSINESS_OVERRIDE,
                "Revenue-impacting request admitted while circuit breaker is open",
                Optional.of(reopensAt), Optional.of(FallbackHint.USE_CACHED_OR_ALTERNATE_PATH),
                CONFIDENCE_BUSINESS_OVERRIDE, snapshot.failureRate(), threshold, false, tier
            );
        }
        return new AdmissionDecision(
            false, BreakerState.OPEN, DecisionReason.OPEN, "Circuit breaker open until " + reopensAt,
            Optional.of(reopensAt), Optional.of(FallbackHint.RETRY_AFTER_RECOVERY),
            CONFIDENCE_DENY, snapshot.failureRate(), threshold, false, tier
        );
    }

    private AdmissionDecision admitProbe(BreakerConfig config, BreakerMetrics metrics, BusinessImpactTier tier, Instant now) {
        int maxProbes = config.timing().halfOpenMaxProbes();
        MetricsSnapshot snapshot = metrics.snapshot(now, config.timing());
        double threshold = Thresholds.effective(config, snapshot);
        if (metrics.probesIssued() < maxProbes) {
            metrics.issueProbe();
            return new AdmissionDecision(
                true, BreakerState.HALF_OPEN, DecisionReason.HALF_OPEN_PROBE,
                String.format("Probe request %d of %d admitted", metrics.probesIssued(), maxProbes),
                Optional.empty(), Optional.empty(), CONFIDENCE_PROBE,
                snapshot.failureRate(), threshold, false, tier
            );
        }
        return new AdmissionDecision(
            false, BreakerState.HALF_OPEN, DecisionReason.HALF_OPEN_QUOTA_EXHAUSTED,
            "Probe quota exhausted, awaiting probe results",
            Optional.empty(), Optional.of(FallbackHint.RETRY_AFTER_RECOVERY), CONFIDENCE_DENY,
            snapshot.failureRate(), threshold, false, tier
        );
    }

    private AdmissionDecision operatorDenial(
        BreakerConfig config,
        BreakerMetrics metrics,
        BusinessImpactTier tier,
        Instant now,
        DecisionReason reason,
        String message,
        FallbackHint hint,
        boolean escalationRequired
    ) {
        MetricsSnapshot snapshot = metrics.snapshot(now, config.timing());
        return new AdmissionDecision(
            false, metrics.state(), reason, message,
            Optional.empty(), Optional.of(hint), CONFIDENCE_OPERATOR,
            snapshot.failureRate(), Thresholds.effective(config, snapshot), escalationRequired, tier
        );
    }

    // ============================================================
    // 결과 기록
    // ============================================================

    @Override
    public void recordSuccess(BreakerId breakerId, Duration latency) {
        Instant now = clock.instant();
        mutate(breakerId, (config, metrics, transitions) -> {
            metrics.recordSuccess(now, latency);
            int required = config.recovery().successThreshold();
            if (metrics.state() == BreakerState.HALF_OPEN && metrics.consecutiveSuccesses() >= required) {
                transitions.add(metrics.transition(TransitionSignal.PROBES_SUCCEEDED, now,
                    String.format("%d consecutive probe successes", metrics.consecutiveSuccesses())));
            }
            return null;
        });
    }

    @Override
    public void recordFailure(BreakerId breakerId, ErrorContext errorContext) {
        if (errorContext == null) {
            throw new IllegalArgumentException("errorContext cannot be null");
        }
        Instant now = clock.instant();
        mutate(breakerId, (config, metrics, transitions) -> {
            metrics.recordFailure(now, errorContext);
            BreakerState state = metrics.state();

            if (requiresEscalation(config.features(), state, errorContext)) {
                transitions.add(metrics.transition(TransitionSignal.EMERGENCY_ESCALATION, now,
                    "Failure at tier " + errorContext.tier() + " requires emergency escalation"));
            } else if (state == BreakerState.HALF_OPEN) {
                transitions.add(metrics.transition(TransitionSignal.PROBE_FAILED, now, "Probe request failed"));
            } else if (state == BreakerState.CLOSED) {
                DetectionResult detection = detector.shouldOpen(config, metrics.snapshot(now, config.timing()));
                if (detection.open()) {
                    transitions.add(metrics.transition(TransitionSignal.THRESHOLD_BREACHED, now, detection.reason()));
                }
            }
            return null;
        });
    }

    private boolean requiresEscalation(BreakerFeatures features, BreakerState state, ErrorContext errorContext) {
        return features.emergencyEscalation()
            && state != BreakerState.EMERGENCY
            && errorContext.tier() != null
            && errorContext.tier().isAtLeast(features.emergencyTier());
    }

    // ============================================================
    // 운영자 제어
    // ============================================================

    @Override
    public void register(BreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        store.register(config);
        dispatcher.configSaved(config);
        log.info("Registered breaker {} ({}, layer {}, tier {})",
            config.breakerId(), config.name(), config.systemLayer(), config.businessImpactTier());
    }

    @Override
    public void updateConfig(BreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        store.replaceConfig(config);
        dispatcher.configSaved(config);
        log.info("Updated config of breaker {}", config.breakerId());
    }

    @Override
    public void deregister(BreakerId breakerId) {
        store.deregister(breakerId);
        cancelForceOpenExpiry(breakerId);
        orchestrator.cancelRecoveryMonitors(breakerId);
        dispatcher.removed(breakerId);
        log.info("Deregistered breaker {}", breakerId);
    }

    @Override
    public void forceOpen(BreakerId breakerId, String reason, Duration autoRevertAfter) {
        if (autoRevertAfter != null && (autoRevertAfter.isZero() || autoRevertAfter.isNegative())) {
            throw new IllegalArgumentException("autoRevertAfter must be positive (current: " + autoRevertAfter + ")");
        }
        String effectiveReason = reason == null || reason.isBlank() ? "Forced open by operator" : reason;
        Instant now = clock.instant();
        StateTransition forced = mutate(breakerId, (config, metrics, transitions) -> {
            StateTransition transition = metrics.transition(TransitionSignal.OPERATOR_FORCE_OPEN, now, effectiveReason);
            transitions.add(transition);
            return transition;
        });

        cancelForceOpenExpiry(breakerId);
        if (autoRevertAfter != null) {
            Instant forcedAt = forced.at();
            forceOpenExpiries.put(breakerId,
                scheduler.schedule(() -> expireForceOpen(breakerId, forcedAt), autoRevertAfter));
            log.info("Breaker {} will revert from FORCE_OPEN after {}", breakerId, autoRevertAfter);
        }
    }

    private void expireForceOpen(BreakerId breakerId, Instant forcedAt) {
        try {
            Instant now = clock.instant();
            mutate(breakerId, (config, metrics, transitions) -> {
                if (metrics.state() == BreakerState.FORCE_OPEN && metrics.stateEnteredAt().equals(forcedAt)) {
                    transitions.add(metrics.transition(TransitionSignal.FORCE_OPEN_EXPIRED, now,
                        "Force-open duration elapsed"));
                }
                return null;
            });
        } catch (BreakerNotFoundException e) {
            log.debug("Force-open expiry skipped, breaker {} is no longer registered", breakerId);
        } catch (Exception e) {
            log.error("Failed to expire force-open of breaker {}", breakerId, e);
        }
    }

    @Override
    public void revert(BreakerId breakerId) {
        Instant now = clock.instant();
        mutate(breakerId, (config, metrics, transitions) -> {
            transitions.add(metrics.transition(TransitionSignal.OPERATOR_REVERT, now, "Reverted by operator"));
            return null;
        });
    }

    @Override
    public void reset(BreakerId breakerId) {
        Instant now = clock.instant();
        mutate(breakerId, (config, metrics, transitions) -> {
            transitions.add(metrics.transition(TransitionSignal.OPERATOR_RESET, now, "Reset by operator"));
            metrics.resetBusinessImpact();
            return null;
        });
    }

    @Override
    public void resolveEmergency(BreakerId breakerId, String resolution) {
        String effectiveResolution = resolution == null || resolution.isBlank() ? "Emergency resolved" : resolution;
        Instant now = clock.instant();
        mutate(breakerId, (config, metrics, transitions) -> {
            transitions.add(metrics.transition(TransitionSignal.EMERGENCY_RESOLVED, now, effectiveResolution));
            return null;
        });
    }

    // ============================================================
    // 상태 조회
    // ============================================================

    @Override
    public BreakerStatus getStatus(BreakerId breakerId) {
        BreakerView view = store.get(breakerId);
        return BreakerStatus.of(view.config(), view.metrics());
    }

    @Override
    public List<BreakerStatus> getAllStatuses() {
        return store.findAll().stream()
            .map(view -> BreakerStatus.of(view.config(), view.metrics()))
            .collect(Collectors.toList());
    }

    @Override
    public StatusSummary summarize() {
        return StatusSummary.of(getAllStatuses());
    }

    // ============================================================
    // 복원
    // ============================================================

    /**
     * 영속 저장소의 breaker를 등록하고 마지막 상태를 복원.
     *
     * <p>이미 등록된 breaker는 설정을 덮어쓰지 않으며, CLOSED가 아닌 상태만 복원합니다.
     * OPEN으로 복원된 breaker는 복원 시각부터 openDuration을 다시 셉니다.
     * 개별 항목 실패는 로그로 남기고 다음 항목을 계속 처리합니다.</p>
     *
     * @return 복원한 breaker 수
     */
    @Override
    public int restore() {
        List<PersistedBreaker> persisted = dispatcher.loadAll();
        int restored = 0;
        for (PersistedBreaker record : persisted) {
            if (tryRestore(record)) {
                restored++;
            }
        }
        log.info("Restore completed: {} restored out of {} persisted", restored, persisted.size());
        return restored;
    }

    private boolean tryRestore(PersistedBreaker record) {
        BreakerId breakerId = record.config().breakerId();
        try {
            if (!store.contains(breakerId)) {
                store.register(record.config());
            }
            if (record.state() != BreakerState.CLOSED) {
                Instant now = clock.instant();
                mutate(breakerId, (config, metrics, transitions) -> {
                    if (metrics.state() == BreakerState.CLOSED) {
                        transitions.add(metrics.restore(record.state(), now, "Restored from persistence"));
                    }
                    return null;
                });
            }
            return true;
        } catch (Exception e) {
            log.error("Failed to restore breaker {}", breakerId, e);
            return false;
        }
    }

    // ============================================================
    // 전이 후처리
    // ============================================================

    private <T> T mutate(BreakerId breakerId, TrackedMutation<T> mutation) {
        if (breakerId == null) {
            throw new IllegalArgumentException("breakerId cannot be null");
        }
        List<StateTransition> transitions = new ArrayList<>(2);
        List<BreakerConfig> seen = new ArrayList<>(1);
        T result = store.update(breakerId, (config, metrics) -> {
            seen.add(config);
            T applied = mutation.apply(config, metrics, transitions);
            for (StateTransition transition : transitions) {
                dispatcher.enqueue(config, transition);
            }
            return applied;
        });
        if (!transitions.isEmpty()) {
            dispatcher.flush(breakerId);
            afterTransitions(seen.get(0), transitions);
        }
        return result;
    }

    private void afterTransitions(BreakerConfig config, List<StateTransition> transitions) {
        BreakerId breakerId = config.breakerId();
        for (StateTransition transition : transitions) {
            if (transition.to() == BreakerState.CLOSED) {
                orchestrator.cancelRecoveryMonitors(breakerId);
            }
            if (transition.from() == BreakerState.FORCE_OPEN && transition.to() != BreakerState.FORCE_OPEN) {
                cancelForceOpenExpiry(breakerId);
            }
            if (transition.signal() == TransitionSignal.THRESHOLD_BREACHED
                || transition.signal() == TransitionSignal.EMERGENCY_ESCALATION) {
                coordinateAsync(config);
            }
        }
    }

    private void coordinateAsync(BreakerConfig config) {
        BreakerFeatures features = config.features();
        if (!settings.coordinateOnTrip()
            || !features.crossSystemCoordination()
            || features.coordinatedLayers().isEmpty()) {
            return;
        }
        BreakerId breakerId = config.breakerId();
        try {
            coordinationExecutor.execute(() -> {
                try {
                    orchestrator.coordinate(breakerId, features.coordinatedLayers());
                } catch (Exception e) {
                    log.error("Coordination triggered by {} failed", breakerId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Coordination triggered by {} rejected by executor", breakerId, e);
        }
    }

    private void cancelForceOpenExpiry(BreakerId breakerId) {
        ScheduledTask previous = forceOpenExpiries.remove(breakerId);
        if (previous != null) {
            previous.cancel();
        }
    }

    /**
     * 락 안에서 실행되며 발생한 전이를 모으는 변경 함수.
     */
    @FunctionalInterface
    private interface TrackedMutation<T> {
        T apply(BreakerConfig config, BreakerMetrics metrics, List<StateTransition> transitions);
    }
}
