package com.ryuqq.isolation.core.config;

/**
 * 적응형 임계값 정책 (불변 record).
 *
 * <p>유효 임계값 = clamp(평활 실패율 + headroom, minThreshold, maxThreshold)</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>smoothingFactor: 지수 평활 계수 α, (0, 1] (기본 0.3)</li>
 *   <li>minThreshold: 유효 임계값 하한, (0, 1] (기본 0.1)</li>
 *   <li>maxThreshold: 유효 임계값 상한, minThreshold 이상 (기본 0.9)</li>
 *   <li>headroom: 평활 실패율 위 여유폭, [0, 1] (기본 0.2)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param smoothingFactor 평활 계수
 * @param minThreshold 하한
 * @param maxThreshold 상한
 * @param headroom 여유폭
 */
public record AdaptivePolicy(
    double smoothingFactor,
    double minThreshold,
    double maxThreshold,
    double headroom
) {

    /**
     * 기본 설정 생성자.
     */
    public AdaptivePolicy() {
        this(0.3, 0.1, 0.9, 0.2);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws InvalidBreakerConfigException 파라미터 검증 실패 시
     */
    public AdaptivePolicy {
        ConfigChecks.requireRatio(smoothingFactor, false, "smoothingFactor");
        ConfigChecks.requireRatio(minThreshold, false, "minThreshold");
        ConfigChecks.requireRatio(maxThreshold, false, "maxThreshold");
        ConfigChecks.requireRatio(headroom, true, "headroom");
        if (minThreshold > maxThreshold) {
            throw new InvalidBreakerConfigException(
                "minThreshold must not exceed maxThreshold (min: " + minThreshold + ", max: " + maxThreshold + ")"
            );
        }
    }

    /**
     * 값을 [minThreshold, maxThreshold]로 제한.
     *
     * @param value 원래 값
     * @return 제한된 값
     */
    public double clamp(double value) {
        if (Double.isNaN(value)) {
            return maxThreshold;
        }
        return Math.max(minThreshold, Math.min(maxThreshold, value));
    }

    public AdaptivePolicy withSmoothingFactor(double smoothingFactor) {
        return new AdaptivePolicy(smoothingFactor, minThreshold, maxThreshold, headroom);
    }

    public AdaptivePolicy withBounds(double minThreshold, double maxThreshold) {
        return new AdaptivePolicy(smoothingFactor, minThreshold, maxThreshold, headroom);
    }

    public AdaptivePolicy withHeadroom(double headroom) {
        return new AdaptivePolicy(smoothingFactor, minThreshold, maxThreshold, headroom);
    }
}
