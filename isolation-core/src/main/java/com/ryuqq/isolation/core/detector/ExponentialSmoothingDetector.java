package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.adaptive.ExponentialSmoothing;
import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * EXPONENTIAL_SMOOTHING: 롤링 창 버킷별 실패율을 지수 평활한 값 ≥ 임계값.
 *
 * <p>평활 계수는 adaptive.smoothingFactor를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExponentialSmoothingDetector implements FailureDetector {

    @Override
    public DetectionResult shouldOpen(BreakerConfig config, MetricsSnapshot snapshot) {
        int minimumSamples = config.detection().minimumSamples();
        double threshold = Thresholds.effective(config, snapshot);
        double alpha = config.adaptive().smoothingFactor();

        if (snapshot.windowTotal() < minimumSamples || snapshot.bucketFailureRates().isEmpty()) {
            return DetectionResult.hold(
                String.format("Minimum samples not reached in window (%d/%d)", snapshot.windowTotal(), minimumSamples),
                new SmoothedEvidence(0.0, snapshot.bucketFailureRates().size(), threshold, alpha)
            );
        }

        double smoothed = ExponentialSmoothing.fold(snapshot.bucketFailureRates(), alpha);
        SmoothedEvidence evidence = new SmoothedEvidence(
            smoothed, snapshot.bucketFailureRates().size(), threshold, alpha
        );
        if (smoothed >= threshold) {
            return DetectionResult.trip(
                String.format("Exponential smoothing: smoothed rate %.3f >= threshold %.3f", smoothed, threshold),
                evidence
            );
        }
        return DetectionResult.hold(
            String.format("Smoothed failure rate %.3f below threshold %.3f", smoothed, threshold),
            evidence
        );
    }
}
