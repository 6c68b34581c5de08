package com.ryuqq.isolation.core.detector;

/**
 * 이상 탐지 평가 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param anomalous 이상이면 true
 * @param score 이상 점수
 * @param description 설명
 */
public record AnomalyVerdict(
    boolean anomalous,
    double score,
    String description
) {

    /**
     * 정상 판정.
     *
     * @return anomalous=false, score=0
     */
    public static AnomalyVerdict normal() {
        return new AnomalyVerdict(false, 0.0, "no anomaly");
    }
}
