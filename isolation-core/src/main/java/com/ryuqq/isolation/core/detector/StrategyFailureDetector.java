package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;
import com.ryuqq.isolation.core.model.DetectionStrategy;

import java.util.EnumMap;
import java.util.Map;

/**
 * Breaker 설정의 전략 선택자에 따라 감지기를 고르는 {@link FailureDetector}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StrategyFailureDetector implements FailureDetector {

    private final Map<DetectionStrategy, FailureDetector> detectors;

    /**
     * 기본 생성자 ({@link NoOpAnomalyModel} 사용).
     */
    public StrategyFailureDetector() {
        this(new NoOpAnomalyModel());
    }

    /**
     * 생성자.
     *
     * @param anomalyModel ANOMALY_BASED 전략이 사용할 모델
     * @throws IllegalArgumentException anomalyModel이 null인 경우
     */
    public StrategyFailureDetector(AnomalyModel anomalyModel) {
        Map<DetectionStrategy, FailureDetector> map = new EnumMap<>(DetectionStrategy.class);
        map.put(DetectionStrategy.SIMPLE_THRESHOLD, new SimpleThresholdDetector());
        map.put(DetectionStrategy.SLIDING_WINDOW, new SlidingWindowDetector());
        map.put(DetectionStrategy.EXPONENTIAL_SMOOTHING, new ExponentialSmoothingDetector());
        map.put(DetectionStrategy.ADAPTIVE_THRESHOLD, new AdaptiveThresholdDetector());
        map.put(DetectionStrategy.ANOMALY_BASED, new AnomalyBasedDetector(anomalyModel));
        this.detectors = map;
    }

    @Override
    public DetectionResult shouldOpen(BreakerConfig config, MetricsSnapshot snapshot) {
        return detectors.get(config.detection().strategy()).shouldOpen(config, snapshot);
    }
}
