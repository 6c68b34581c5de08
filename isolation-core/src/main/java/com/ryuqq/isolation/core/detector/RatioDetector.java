package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * 누적 실패율 감지기 공통 구현.
 *
 * <p>현재 평가 창의 failures/total을 유효 임계값과 비교합니다.
 * SIMPLE_THRESHOLD와 ADAPTIVE_THRESHOLD가 이 계산을 공유하고
 * 전략 이름만 다릅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
abstract class RatioDetector implements FailureDetector {

    @Override
    public DetectionResult shouldOpen(BreakerConfig config, MetricsSnapshot snapshot) {
        int minimumSamples = config.detection().minimumSamples();
        double threshold = Thresholds.effective(config, snapshot);
        RatioEvidence evidence = new RatioEvidence(
            snapshot.failureCount(),
            snapshot.totalCount(),
            snapshot.failureRate(),
            threshold,
            minimumSamples,
            Thresholds.isAdaptive(config, snapshot)
        );

        if (snapshot.totalCount() < minimumSamples) {
            return DetectionResult.hold(
                String.format("Minimum samples not reached (%d/%d)", snapshot.totalCount(), minimumSamples),
                evidence
            );
        }
        if (snapshot.failureRate() >= threshold) {
            return DetectionResult.trip(
                String.format("%s: failure rate %.3f >= threshold %.3f (%d/%d)",
                    label(), snapshot.failureRate(), threshold, snapshot.failureCount(), snapshot.totalCount()),
                evidence
            );
        }
        return DetectionResult.hold(
            String.format("Failure rate %.3f below threshold %.3f", snapshot.failureRate(), threshold),
            evidence
        );
    }

    abstract String label();
}
