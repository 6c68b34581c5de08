package com.ryuqq.isolation.core.status;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * 상태 조회 결과 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param config breaker 설정
 * @param metrics 지표 스냅샷
 * @param health 건강 요약
 */
public record BreakerStatus(
    BreakerConfig config,
    MetricsSnapshot metrics,
    HealthSummary health
) {

    /**
     * 설정과 스냅샷으로 상태 생성.
     *
     * @param config breaker 설정
     * @param metrics 지표 스냅샷
     * @return BreakerStatus
     */
    public static BreakerStatus of(BreakerConfig config, MetricsSnapshot metrics) {
        return new BreakerStatus(config, metrics, HealthSummary.from(config, metrics));
    }
}
