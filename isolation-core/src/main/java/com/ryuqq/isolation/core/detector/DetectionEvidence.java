package com.ryuqq.isolation.core.detector;

/**
 * 감지 판정 근거.
 *
 * <p>전략마다 필드가 다르므로 variant별 record로 표현합니다:</p>
 * <ul>
 *   <li>{@link RatioEvidence}: 누적 실패율 비교 (SIMPLE_THRESHOLD, ADAPTIVE_THRESHOLD)</li>
 *   <li>{@link WindowEvidence}: 롤링 창 실패율 비교 (SLIDING_WINDOW)</li>
 *   <li>{@link SmoothedEvidence}: 평활 실패율 비교 (EXPONENTIAL_SMOOTHING)</li>
 *   <li>{@link AnomalyEvidence}: 이상 탐지 모델 점수 (ANOMALY_BASED)</li>
 *   <li>{@link DetectorFault}: 감지기 자체 오류</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface DetectionEvidence
    permits RatioEvidence, WindowEvidence, SmoothedEvidence, AnomalyEvidence, DetectorFault {

    /**
     * 감지기 오류로 인한 판정인지 확인.
     *
     * @return DetectorFault이면 true
     */
    default boolean isFault() {
        return this instanceof DetectorFault;
    }
}
