package com.ryuqq.isolation.core.status;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.BreakerMetrics;
import com.ryuqq.isolation.core.model.BusinessImpactTier;
import com.ryuqq.isolation.core.model.ErrorContext;
import com.ryuqq.isolation.core.statemachine.TransitionSignal;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HealthSummary / StatusSummary 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HealthSummaryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void closed_IsHealthy() {
        BreakerConfig config = BreakerConfig.builder("orders").build();

        HealthSummary health = HealthSummary.from(config, metrics(config).snapshot(T0, config.timing()));

        assertThat(health.level()).isEqualTo(HealthLevel.HEALTHY);
        assertThat(health.baselineThreshold()).isEqualTo(0.5);
        assertThat(health.effectiveThreshold()).isEqualTo(0.5);
    }

    @Test
    void open_CriticalTier_IsCritical() {
        BreakerConfig medium = BreakerConfig.builder("orders").build();
        BreakerConfig critical = BreakerConfig.builder("billing").businessImpactTier(BusinessImpactTier.CRITICAL).build();
        BreakerMetrics mediumMetrics = metrics(medium);
        BreakerMetrics criticalMetrics = metrics(critical);
        mediumMetrics.transition(TransitionSignal.THRESHOLD_BREACHED, T0, "tripped");
        criticalMetrics.transition(TransitionSignal.THRESHOLD_BREACHED, T0, "tripped");

        assertThat(HealthSummary.from(medium, mediumMetrics.snapshot(T0, medium.timing())).level())
            .isEqualTo(HealthLevel.ISOLATED);
        assertThat(HealthSummary.from(critical, criticalMetrics.snapshot(T0, critical.timing())).level())
            .isEqualTo(HealthLevel.CRITICAL);
    }

    @Test
    void emergency_PastReviewDeadline_ReportsOverdue() {
        BreakerConfig config = BreakerConfig.builder("orders").build();
        BreakerMetrics metrics = metrics(config);
        metrics.transition(TransitionSignal.EMERGENCY_ESCALATION, T0, "escalated");

        HealthSummary beforeDeadline = HealthSummary.from(config, metrics.snapshot(T0.plusSeconds(60), config.timing()));
        HealthSummary afterDeadline = HealthSummary.from(config,
            metrics.snapshot(T0.plus(Duration.ofMinutes(6)), config.timing()));

        assertThat(beforeDeadline.level()).isEqualTo(HealthLevel.CRITICAL);
        assertThat(beforeDeadline.message()).isEqualTo("Emergency escalation required");
        assertThat(afterDeadline.message()).startsWith("Emergency escalation overdue");
    }

    @Test
    void statusSummary_CountsByLevelAndState() {
        BreakerConfig healthy = BreakerConfig.builder("a").build();
        BreakerConfig forced = BreakerConfig.builder("b").build();
        BreakerConfig emergency = BreakerConfig.builder("c").build();
        BreakerMetrics healthyMetrics = metrics(healthy);
        BreakerMetrics forcedMetrics = metrics(forced);
        BreakerMetrics emergencyMetrics = metrics(emergency);
        healthyMetrics.recordFailure(T0, ErrorContext.revenueImpacting(BusinessImpactTier.HIGH, 40.0));
        forcedMetrics.transition(TransitionSignal.OPERATOR_FORCE_OPEN, T0, "maintenance");
        emergencyMetrics.recordFailure(T0, ErrorContext.revenueImpacting(BusinessImpactTier.CRITICAL, 60.0));
        emergencyMetrics.transition(TransitionSignal.EMERGENCY_ESCALATION, T0, "escalated");

        StatusSummary summary = StatusSummary.of(List.of(
            BreakerStatus.of(healthy, healthyMetrics.snapshot(T0, healthy.timing())),
            BreakerStatus.of(forced, forcedMetrics.snapshot(T0, forced.timing())),
            BreakerStatus.of(emergency, emergencyMetrics.snapshot(T0, emergency.timing()))
        ));

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.healthy()).isEqualTo(1);
        assertThat(summary.isolated()).isEqualTo(1);
        assertThat(summary.critical()).isEqualTo(1);
        assertThat(summary.forcedOpen()).isEqualTo(1);
        assertThat(summary.emergency()).isEqualTo(1);
        assertThat(summary.totalValueAtRisk()).isEqualTo(100.0);
    }

    private BreakerMetrics metrics(BreakerConfig config) {
        return new BreakerMetrics(T0, config.detection(), BreakerMetrics.DEFAULT_HISTORY_LIMIT);
    }
}
