package com.ryuqq.isolation.core.status;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.detector.Thresholds;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.model.BusinessImpactTier;

/**
 * Breaker 건강 요약 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param level 건강 수준
 * @param message 사람이 읽는 요약
 * @param baselineThreshold 설정된 기준 임계값
 * @param effectiveThreshold 현재 적용 중인 임계값
 */
public record HealthSummary(
    HealthLevel level,
    String message,
    double baselineThreshold,
    double effectiveThreshold
) {

    /**
     * 설정과 스냅샷으로부터 요약 생성.
     *
     * @param config breaker 설정
     * @param snapshot 지표 스냅샷
     * @return HealthSummary
     */
    public static HealthSummary from(BreakerConfig config, MetricsSnapshot snapshot) {
        double baseline = config.baselineThreshold();
        double effective = Thresholds.effective(config, snapshot);
        boolean criticalTier = config.businessImpactTier().isAtLeast(BusinessImpactTier.CRITICAL);

        BreakerState state = snapshot.state();
        HealthLevel level = switch (state) {
            case CLOSED -> HealthLevel.HEALTHY;
            case HALF_OPEN -> HealthLevel.RECOVERING;
            case OPEN, FORCE_OPEN -> criticalTier ? HealthLevel.CRITICAL : HealthLevel.ISOLATED;
            case EMERGENCY -> HealthLevel.CRITICAL;
        };

        String message = switch (state) {
            case CLOSED -> String.format("Operating normally (failure rate %.3f, threshold %.3f)",
                snapshot.failureRate(), effective);
            case HALF_OPEN -> String.format("Probing recovery (%d/%d consecutive successes)",
                snapshot.consecutiveSuccesses(), config.recovery().successThreshold());
            case OPEN -> "Isolated until " + snapshot.earliestReevaluationAt().orElse(snapshot.stateEnteredAt());
            case FORCE_OPEN -> "Forced open by operator since " + snapshot.stateEnteredAt();
            case EMERGENCY -> snapshot.escalationReviewDueAt()
                .filter(due -> snapshot.capturedAt().isAfter(due))
                .map(due -> "Emergency escalation overdue since " + due)
                .orElse("Emergency escalation required");
        };
        return new HealthSummary(level, message, baseline, effective);
    }
}
