package com.ryuqq.isolation.core.detector;

/**
 * ADAPTIVE_THRESHOLD: 누적 실패율을 재보정된 유효 임계값과 비교.
 *
 * <p>재보정이 아직 한 번도 실행되지 않았으면 기준 임계값을 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AdaptiveThresholdDetector extends RatioDetector {

    @Override
    String label() {
        return "Adaptive threshold";
    }
}
