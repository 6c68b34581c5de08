package com.ryuqq.isolation.core.detector;

/**
 * SIMPLE_THRESHOLD: 현재 평가 창의 누적 실패율 ≥ 임계값.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SimpleThresholdDetector extends RatioDetector {

    @Override
    String label() {
        return "Simple threshold";
    }
}
