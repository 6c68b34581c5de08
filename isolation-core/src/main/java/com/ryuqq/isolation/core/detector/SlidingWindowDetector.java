package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * SLIDING_WINDOW: timeWindow 안의 결과만으로 실패율을 계산.
 *
 * <p>창 밖의 오래된 표본은 버리므로 최근 폭주에 빠르게 반응합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SlidingWindowDetector implements FailureDetector {

    @Override
    public DetectionResult shouldOpen(BreakerConfig config, MetricsSnapshot snapshot) {
        int minimumSamples = config.detection().minimumSamples();
        double threshold = Thresholds.effective(config, snapshot);
        double rate = snapshot.windowFailureRate();
        WindowEvidence evidence = new WindowEvidence(
            snapshot.windowFailures(), snapshot.windowTotal(), rate, threshold, config.detection().timeWindow()
        );

        if (snapshot.windowTotal() < minimumSamples) {
            return DetectionResult.hold(
                String.format("Minimum samples not reached in window (%d/%d)", snapshot.windowTotal(), minimumSamples),
                evidence
            );
        }
        if (rate >= threshold) {
            return DetectionResult.trip(
                String.format("Sliding window: failure rate %.3f >= threshold %.3f within %s",
                    rate, threshold, config.detection().timeWindow()),
                evidence
            );
        }
        return DetectionResult.hold(
            String.format("Window failure rate %.3f below threshold %.3f", rate, threshold),
            evidence
        );
    }
}
