package com.ryuqq.isolation.core.model;

/**
 * 장애 감지 알고리즘 선택자.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DetectionStrategy {
    /** 누적 실패율 ≥ 임계값 */
    SIMPLE_THRESHOLD,
    /** 시간 창 안의 실패율 ≥ 임계값 */
    SLIDING_WINDOW,
    /** 버킷별 실패율의 지수 평활값 ≥ 임계값 */
    EXPONENTIAL_SMOOTHING,
    /** 재보정된 유효 임계값 사용 */
    ADAPTIVE_THRESHOLD,
    /** 외부 이상 탐지 모델에 위임 */
    ANOMALY_BASED
}
