package com.ryuqq.isolation.core.spi;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * 일관된 시점의 (config, metrics) 읽기 전용 쌍.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param config breaker 설정
 * @param metrics 지표 스냅샷
 */
public record BreakerView(
    BreakerConfig config,
    MetricsSnapshot metrics
) {
}
