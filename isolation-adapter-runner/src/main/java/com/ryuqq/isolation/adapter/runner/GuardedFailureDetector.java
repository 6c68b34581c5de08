package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.detector.DetectionResult;
import com.ryuqq.isolation.core.detector.DetectorFault;
import com.ryuqq.isolation.core.detector.FailureDetector;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * 감지기 예외를 차단 판정으로 바꾸는 {@link FailureDetector} 래퍼.
 *
 * <p>감지기가 예외를 던지거나 결과를 돌려주지 않으면 {@link DetectorFault} 근거와 함께
 * open=true를 반환하고, 애플리케이션 실패와 구분되도록 {@code DETECTOR_FAILURE} 마커로
 * ERROR 로그를 남깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GuardedFailureDetector implements FailureDetector {

    private static final Logger log = LoggerFactory.getLogger(GuardedFailureDetector.class);

    /** 감지기 장애 로그 마커 */
    public static final Marker DETECTOR_FAILURE = MarkerFactory.getMarker("DETECTOR_FAILURE");

    private final FailureDetector delegate;

    /**
     * 생성자.
     *
     * @param delegate 실제 감지기
     * @throws IllegalArgumentException delegate가 null인 경우
     */
    public GuardedFailureDetector(FailureDetector delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public DetectionResult shouldOpen(BreakerConfig config, MetricsSnapshot snapshot) {
        DetectionResult result;
        try {
            result = delegate.shouldOpen(config, snapshot);
        } catch (RuntimeException e) {
            log.error(DETECTOR_FAILURE, "Failure detector threw for breaker {}, opening breaker",
                config.breakerId(), e);
            return DetectionResult.trip(
                "Detector failure: " + e.getClass().getSimpleName(),
                new DetectorFault(config.detection().strategy(), e.getClass().getName(), String.valueOf(e.getMessage()))
            );
        }
        if (result == null) {
            log.error(DETECTOR_FAILURE, "Failure detector returned no result for breaker {}, opening breaker",
                config.breakerId());
            return DetectionResult.trip(
                "Detector failure: no result",
                new DetectorFault(config.detection().strategy(), "NoResult", "detector returned null")
            );
        }
        return result;
    }
}
