package com.ryuqq.isolation.core.detector;

/**
 * 이상 탐지 모델 판정 근거.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param model 모델 이름
 * @param score 이상 점수
 * @param description 모델 설명
 */
public record AnomalyEvidence(
    String model,
    double score,
    String description
) implements DetectionEvidence {
}
