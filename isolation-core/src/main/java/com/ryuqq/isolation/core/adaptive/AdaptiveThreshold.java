package com.ryuqq.isolation.core.adaptive;

/**
 * 재보정 결과 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param effective 유효 임계값 ([minThreshold, maxThreshold] 안)
 * @param smoothedFailureRate 평활 실패율 (표본이 없으면 0)
 * @param baseline 설정된 기준 임계값
 * @param samples 평활에 사용한 버킷 수
 */
public record AdaptiveThreshold(
    double effective,
    double smoothedFailureRate,
    double baseline,
    int samples
) {
}
