package com.ryuqq.isolation.core.detector;

/**
 * 누적 실패율 판정 근거.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param failures 실패 수
 * @param total 전체 수
 * @param failureRate 실패율
 * @param threshold 비교한 임계값
 * @param minimumSamples 최소 표본 수
 * @param adaptive 재보정된 임계값을 사용했으면 true
 */
public record RatioEvidence(
    long failures,
    long total,
    double failureRate,
    double threshold,
    int minimumSamples,
    boolean adaptive
) implements DetectionEvidence {
}
