package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * 판정에 사용할 임계값 결정.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Thresholds {

    // Utility class - prevent instantiation
    private Thresholds() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 유효 임계값.
     *
     * <p>재보정 대상이고 재보정 값이 있으면 그 값, 아니면 기준 임계값입니다.</p>
     *
     * @param config breaker 설정
     * @param snapshot 지표 스냅샷
     * @return 임계값
     */
    public static double effective(BreakerConfig config, MetricsSnapshot snapshot) {
        if (isAdaptive(config, snapshot)) {
            return snapshot.effectiveThreshold().getAsDouble();
        }
        return config.baselineThreshold();
    }

    /**
     * 재보정된 임계값이 적용되는지 확인.
     *
     * @param config breaker 설정
     * @param snapshot 지표 스냅샷
     * @return 적용되면 true
     */
    public static boolean isAdaptive(BreakerConfig config, MetricsSnapshot snapshot) {
        return config.usesAdaptiveThreshold() && snapshot.effectiveThreshold().isPresent();
    }
}
