package com.ryuqq.isolation.core.detector;

/**
 * 지수 평활 실패율 판정 근거.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param smoothedRate 평활 실패율
 * @param buckets 평활에 사용한 버킷 수
 * @param threshold 비교한 임계값
 * @param smoothingFactor 평활 계수
 */
public record SmoothedEvidence(
    double smoothedRate,
    int buckets,
    double threshold,
    double smoothingFactor
) implements DetectionEvidence {
}
