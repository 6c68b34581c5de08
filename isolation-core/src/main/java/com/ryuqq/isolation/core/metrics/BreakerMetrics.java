package com.ryuqq.isolation.core.metrics;

import com.ryuqq.isolation.core.config.DetectionPolicy;
import com.ryuqq.isolation.core.config.TimingPolicy;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.model.BusinessImpactTier;
import com.ryuqq.isolation.core.model.ErrorContext;
import com.ryuqq.isolation.core.statemachine.BreakerTransitions;
import com.ryuqq.isolation.core.statemachine.StateTransition;
import com.ryuqq.isolation.core.statemachine.TransitionSignal;
import com.ryuqq.isolation.core.statemachine.TriggerMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Breaker 하나의 가변 지표와 상태.
 *
 * <p>상태 전이는 {@link #transition(TransitionSignal, Instant, String)}으로만 일어나며,
 * 전이 규칙은 {@link BreakerTransitions}가 검증합니다.</p>
 *
 * <p><strong>카운터 초기화 규칙:</strong></p>
 * <ul>
 *   <li>HALF_OPEN 진입: 평가 창(실패/성공/연속 성공/롤링 창) 초기화</li>
 *   <li>CLOSED 진입 (probe 성공, 강제 차단 해제, 운영자 초기화): 평가 창 전체 초기화</li>
 *   <li>그 외 전이에서는 초기화하지 않음 (probe 수는 매 전이마다 0)</li>
 *   <li>비즈니스 영향 집계는 {@link #resetBusinessImpact()}로만 초기화</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 동기화하지 않습니다.
 * BreakerStore가 breaker별 락 안에서만 이 객체를 노출해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BreakerMetrics {

    /** 기본 전이 이력 보관 수 */
    public static final int DEFAULT_HISTORY_LIMIT = 100;

    private final int historyLimit;
    private final Deque<StateTransition> history;
    private RollingOutcomeWindow window;

    private BreakerState state = BreakerState.CLOSED;
    private Instant stateEnteredAt;
    private Instant lastTransitionAt;

    private long failureCount;
    private long successCount;
    private long consecutiveSuccesses;
    private int probesIssued;

    private long latencySamples;
    private long totalLatencyNanos;
    private Instant lastFailureAt;
    private Instant lastSuccessAt;

    private double valueAtRisk;
    private long revenueImpactingFailures;
    private long customerFacingFailures;
    private BusinessImpactTier worstTier;

    private Double effectiveThreshold;
    private Double smoothedFailureRate;

    /**
     * 생성자 (CLOSED, 모든 카운터 0).
     *
     * @param createdAt 등록 시각
     * @param detection 롤링 창 설정을 담은 감지 정책
     * @param historyLimit 전이 이력 보관 수 (1 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BreakerMetrics(Instant createdAt, DetectionPolicy detection, int historyLimit) {
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (detection == null) {
            throw new IllegalArgumentException("detection cannot be null");
        }
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive (current: " + historyLimit + ")");
        }
        this.historyLimit = historyLimit;
        this.history = new ArrayDeque<>();
        this.window = new RollingOutcomeWindow(detection.timeWindow(), detection.windowBuckets());
        this.stateEnteredAt = createdAt;
        this.lastTransitionAt = createdAt;
    }

    /**
     * 성공 기록.
     *
     * @param at 발생 시각
     * @param latency 요청 지연 (nullable)
     */
    public void recordSuccess(Instant at, Duration latency) {
        successCount++;
        consecutiveSuccesses++;
        window.record(at, false);
        lastSuccessAt = at;
        if (latency != null && !latency.isNegative()) {
            latencySamples++;
            totalLatencyNanos += latency.toNanos();
        }
    }

    /**
     * 실패 기록 및 비즈니스 영향 누적.
     *
     * @param at 발생 시각
     * @param context 실패 컨텍스트
     */
    public void recordFailure(Instant at, ErrorContext context) {
        failureCount++;
        consecutiveSuccesses = 0;
        window.record(at, true);
        lastFailureAt = at;

        valueAtRisk += context.valueAtRisk();
        if (context.revenueImpacting()) {
            revenueImpactingFailures++;
        }
        if (context.customerFacing()) {
            customerFacingFailures++;
        }
        if (context.tier() != null && (worstTier == null || context.tier().isAtLeast(worstTier))) {
            worstTier = context.tier();
        }
    }

    /**
     * HALF_OPEN probe 허용 기록.
     */
    public void issueProbe() {
        probesIssued++;
    }

    /**
     * 상태 전이 적용.
     *
     * <p>전이 시각은 이전 전이 시각보다 앞설 수 없으며, 시계가 뒤로 간 경우 이전 시각으로 맞춥니다.</p>
     *
     * @param signal 전이 신호
     * @param at 전이 시각
     * @param reason 사유
     * @return 기록된 전이
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public StateTransition transition(TransitionSignal signal, Instant at, String reason) {
        BreakerState to = BreakerTransitions.target(state, signal);
        return enter(to, signal, at, reason);
    }

    /**
     * 영속 상태 복원 (등록 직후 CLOSED에서만 허용).
     *
     * @param to 복원할 상태
     * @param at 복원 시각
     * @param reason 사유
     * @return 기록된 전이
     * @throws IllegalStateException 현재 상태가 CLOSED가 아닌 경우
     */
    public StateTransition restore(BreakerState to, Instant at, String reason) {
        BreakerState target = BreakerTransitions.restore(state, to);
        return enter(target, TransitionSignal.RESTORED, at, reason);
    }

    private StateTransition enter(BreakerState to, TransitionSignal signal, Instant at, String reason) {
        Instant effectiveAt = at.isBefore(lastTransitionAt) ? lastTransitionAt : at;
        StateTransition transition = new StateTransition(state, to, signal, effectiveAt, reason, trigger());

        state = to;
        stateEnteredAt = effectiveAt;
        lastTransitionAt = effectiveAt;
        probesIssued = 0;
        if (to == BreakerState.HALF_OPEN || to == BreakerState.CLOSED) {
            resetEvaluationWindow();
        }

        history.addLast(transition);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
        return transition;
    }

    /**
     * 재보정 결과 기록. 카운터에는 영향을 주지 않습니다.
     *
     * @param effective 유효 임계값
     * @param smoothed 평활 실패율
     */
    public void applyAdaptiveThreshold(double effective, double smoothed) {
        this.effectiveThreshold = effective;
        this.smoothedFailureRate = smoothed;
    }

    /**
     * 비즈니스 영향 집계 초기화 (운영자 reset 전용).
     */
    public void resetBusinessImpact() {
        valueAtRisk = 0.0;
        revenueImpactingFailures = 0;
        customerFacingFailures = 0;
        worstTier = null;
    }

    /**
     * 롤링 창 재구성 (설정 변경 시). 기존 창의 표본은 버려집니다.
     *
     * @param detection 새 감지 정책
     */
    public void reconfigureWindow(DetectionPolicy detection) {
        this.window = new RollingOutcomeWindow(detection.timeWindow(), detection.windowBuckets());
    }

    private void resetEvaluationWindow() {
        failureCount = 0;
        successCount = 0;
        consecutiveSuccesses = 0;
        window.reset();
    }

    private TriggerMetrics trigger() {
        long total = failureCount + successCount;
        double rate = total == 0 ? 0.0 : (double) failureCount / total;
        return new TriggerMetrics(failureCount, successCount, total, rate, consecutiveSuccesses);
    }

    /**
     * 불변 스냅샷 생성.
     *
     * @param now 기준 시각
     * @param timing 재평가/검토 시각 계산용 시간 정책
     * @return MetricsSnapshot
     */
    public MetricsSnapshot snapshot(Instant now, TimingPolicy timing) {
        Optional<Instant> reevaluation = state == BreakerState.OPEN
            ? Optional.of(stateEnteredAt.plus(timing.openDuration()))
            : Optional.empty();
        Optional<Instant> reviewDue = state == BreakerState.EMERGENCY
            ? Optional.of(stateEnteredAt.plus(timing.emergencyDuration()))
            : Optional.empty();
        Duration averageLatency = latencySamples == 0
            ? Duration.ZERO
            : Duration.ofNanos(totalLatencyNanos / latencySamples);

        return new MetricsSnapshot(
            state,
            failureCount,
            successCount,
            consecutiveSuccesses,
            probesIssued,
            window.failures(now),
            window.total(now),
            window.bucketFailureRates(now),
            averageLatency,
            Optional.ofNullable(lastFailureAt),
            Optional.ofNullable(lastSuccessAt),
            stateEnteredAt,
            reevaluation,
            reviewDue,
            effectiveThreshold == null ? OptionalDouble.empty() : OptionalDouble.of(effectiveThreshold),
            smoothedFailureRate == null ? OptionalDouble.empty() : OptionalDouble.of(smoothedFailureRate),
            new ImpactTotals(valueAtRisk, revenueImpactingFailures, customerFacingFailures,
                Optional.ofNullable(worstTier)),
            new ArrayList<>(history),
            now
        );
    }

    public BreakerState state() {
        return state;
    }

    public Instant stateEnteredAt() {
        return stateEnteredAt;
    }

    public long failureCount() {
        return failureCount;
    }

    public long successCount() {
        return successCount;
    }

    public long consecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    public int probesIssued() {
        return probesIssued;
    }
}
