package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * 이상을 보고하지 않는 기본 {@link AnomalyModel}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpAnomalyModel implements AnomalyModel {

    @Override
    public AnomalyVerdict evaluate(BreakerConfig config, MetricsSnapshot snapshot) {
        return AnomalyVerdict.normal();
    }

    @Override
    public String name() {
        return "noop";
    }
}
