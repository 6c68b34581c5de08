package com.ryuqq.isolation.core.detector;

import java.time.Duration;

/**
 * 롤링 창 실패율 판정 근거.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param windowFailures 창 안의 실패 수
 * @param windowTotal 창 안의 전체 수
 * @param failureRate 창 실패율
 * @param threshold 비교한 임계값
 * @param timeWindow 창 길이
 */
public record WindowEvidence(
    long windowFailures,
    long windowTotal,
    double failureRate,
    double threshold,
    Duration timeWindow
) implements DetectionEvidence {
}
