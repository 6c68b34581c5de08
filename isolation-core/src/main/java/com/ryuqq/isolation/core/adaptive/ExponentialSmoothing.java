package com.ryuqq.isolation.core.adaptive;

import java.util.List;

/**
 * 지수 평활 (EWMA).
 *
 * <pre>
 * s₀ = x₀
 * sₙ = α·xₙ + (1 − α)·sₙ₋₁
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExponentialSmoothing {

    // Utility class - prevent instantiation
    private ExponentialSmoothing() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 시간 순 관측값을 평활.
     *
     * @param observations 관측값 (오래된 순, 비어 있으면 안 됨)
     * @param alpha 평활 계수 (0, 1]
     * @return 마지막 평활값
     * @throws IllegalArgumentException observations가 비어 있거나 alpha가 범위를 벗어난 경우
     */
    public static double fold(List<Double> observations, double alpha) {
        if (observations == null || observations.isEmpty()) {
            throw new IllegalArgumentException("observations cannot be null or empty");
        }
        if (!(alpha > 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0, 1] (current: " + alpha + ")");
        }
        double smoothed = observations.get(0);
        for (int i = 1; i < observations.size(); i++) {
            smoothed = alpha * observations.get(i) + (1.0 - alpha) * smoothed;
        }
        return smoothed;
    }
}
