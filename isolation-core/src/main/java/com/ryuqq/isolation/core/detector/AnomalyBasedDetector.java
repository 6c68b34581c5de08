package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * ANOMALY_BASED: {@link AnomalyModel}에 판정을 위임.
 *
 * <p>minimumSamples 규칙은 다른 전략과 동일하게 적용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AnomalyBasedDetector implements FailureDetector {

    private final AnomalyModel model;

    /**
     * 생성자.
     *
     * @param model 이상 탐지 모델
     * @throws IllegalArgumentException model이 null인 경우
     */
    public AnomalyBasedDetector(AnomalyModel model) {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        this.model = model;
    }

    @Override
    public DetectionResult shouldOpen(BreakerConfig config, MetricsSnapshot snapshot) {
        int minimumSamples = config.detection().minimumSamples();
        if (snapshot.totalCount() < minimumSamples) {
            return DetectionResult.hold(
                String.format("Minimum samples not reached (%d/%d)", snapshot.totalCount(), minimumSamples),
                new AnomalyEvidence(model.name(), 0.0, "not evaluated")
            );
        }
        AnomalyVerdict verdict = model.evaluate(config, snapshot);
        AnomalyEvidence evidence = new AnomalyEvidence(model.name(), verdict.score(), verdict.description());
        if (verdict.anomalous()) {
            return DetectionResult.trip(
                String.format("Anomaly detected by %s (score %.3f): %s", model.name(), verdict.score(), verdict.description()),
                evidence
            );
        }
        return DetectionResult.hold("No anomaly detected by " + model.name(), evidence);
    }
}
