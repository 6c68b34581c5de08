package com.ryuqq.isolation.core.config;

import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerType;
import com.ryuqq.isolation.core.model.BusinessImpactTier;
import com.ryuqq.isolation.core.model.DetectionStrategy;
import com.ryuqq.isolation.core.model.SystemLayer;

/**
 * Circuit breaker 설정 (불변 record).
 *
 * <p>등록 시 한 번 생성되며, 이후에는 updateConfig를 통해 전체가 교체될 때만 바뀝니다.
 * 모든 불변식은 생성 시점에 검증되므로 존재하는 BreakerConfig는 항상 유효합니다.</p>
 *
 * <p><strong>교차 검증:</strong></p>
 * <ul>
 *   <li>halfOpenMaxProbes ≥ successThreshold (probe 창 안에서 CLOSED 도달 가능해야 함)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BreakerConfig config = BreakerConfig.builder("payment-gateway")
 *     .systemLayer(SystemLayer.EXTERNAL_SERVICES)
 *     .businessImpactTier(BusinessImpactTier.CRITICAL)
 *     .detection(new DetectionPolicy().withFailureThreshold(0.4))
 *     .features(new BreakerFeatures().withAdaptiveThresholds(true))
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param breakerId 식별자
 * @param name 사람이 읽는 이름
 * @param type 보호 범위 분류
 * @param systemLayer 보호 계층
 * @param businessImpactTier 이 breaker가 열릴 때의 영향 등급
 * @param detection 감지 정책
 * @param timing 시간 정책
 * @param recovery 복구 정책
 * @param adaptive 적응형 임계값 정책
 * @param features 기능 플래그
 */
public record BreakerConfig(
    BreakerId breakerId,
    String name,
    BreakerType type,
    SystemLayer systemLayer,
    BusinessImpactTier businessImpactTier,
    DetectionPolicy detection,
    TimingPolicy timing,
    RecoveryPolicy recovery,
    AdaptivePolicy adaptive,
    BreakerFeatures features
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws InvalidBreakerConfigException 파라미터 검증 실패 시
     */
    public BreakerConfig {
        ConfigChecks.requireNonNull(breakerId, "breakerId");
        if (name == null || name.isBlank()) {
            throw new InvalidBreakerConfigException("name cannot be null or blank");
        }
        ConfigChecks.requireNonNull(type, "type");
        ConfigChecks.requireNonNull(systemLayer, "systemLayer");
        ConfigChecks.requireNonNull(businessImpactTier, "businessImpactTier");
        ConfigChecks.requireNonNull(detection, "detection");
        ConfigChecks.requireNonNull(timing, "timing");
        ConfigChecks.requireNonNull(recovery, "recovery");
        ConfigChecks.requireNonNull(adaptive, "adaptive");
        ConfigChecks.requireNonNull(features, "features");
        if (timing.halfOpenMaxProbes() < recovery.successThreshold()) {
            throw new InvalidBreakerConfigException(
                "halfOpenMaxProbes must be at least successThreshold (halfOpenMaxProbes: "
                    + timing.halfOpenMaxProbes() + ", successThreshold: " + recovery.successThreshold() + ")"
            );
        }
    }

    /**
     * 기본 정책으로 시작하는 빌더 생성.
     *
     * @param breakerId 식별자 문자열
     * @return Builder
     * @throws IllegalArgumentException 식별자가 유효하지 않은 경우
     */
    public static Builder builder(String breakerId) {
        return new Builder(BreakerId.of(breakerId));
    }

    /**
     * 현재 값으로 채워진 빌더 생성 (updateConfig용).
     *
     * @return Builder
     */
    public Builder toBuilder() {
        return new Builder(breakerId)
            .name(name)
            .type(type)
            .systemLayer(systemLayer)
            .businessImpactTier(businessImpactTier)
            .detection(detection)
            .timing(timing)
            .recovery(recovery)
            .adaptive(adaptive)
            .features(features);
    }

    /**
     * 적응형 임계값 미적용 시의 기준 임계값.
     *
     * @return detection.failureThreshold
     */
    public double baselineThreshold() {
        return detection.failureThreshold();
    }

    /**
     * 적응형 임계값 재보정 대상인지 확인.
     *
     * <p>adaptiveThresholds 플래그가 켜져 있거나 감지 전략이 ADAPTIVE_THRESHOLD이면 대상입니다.</p>
     *
     * @return 재보정 대상이면 true
     */
    public boolean usesAdaptiveThreshold() {
        return features.adaptiveThresholds() || detection.strategy() == DetectionStrategy.ADAPTIVE_THRESHOLD;
    }

    /**
     * BreakerConfig 빌더.
     *
     * <p>지정하지 않은 항목은 각 정책 record의 기본값을 사용합니다.
     * name의 기본값은 breakerId 문자열입니다.</p>
     */
    public static final class Builder {

        private final BreakerId breakerId;
        private String name;
        private BreakerType type = BreakerType.SERVICE_LEVEL;
        private SystemLayer systemLayer = SystemLayer.API;
        private BusinessImpactTier businessImpactTier = BusinessImpactTier.MEDIUM;
        private DetectionPolicy detection = new DetectionPolicy();
        private TimingPolicy timing = new TimingPolicy();
        private RecoveryPolicy recovery = new RecoveryPolicy();
        private AdaptivePolicy adaptive = new AdaptivePolicy();
        private BreakerFeatures features = new BreakerFeatures();

        private Builder(BreakerId breakerId) {
            this.breakerId = breakerId;
            this.name = breakerId.getValue();
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(BreakerType type) {
            this.type = type;
            return this;
        }

        public Builder systemLayer(SystemLayer systemLayer) {
            this.systemLayer = systemLayer;
            return this;
        }

        public Builder businessImpactTier(BusinessImpactTier businessImpactTier) {
            this.businessImpactTier = businessImpactTier;
            return this;
        }

        public Builder detection(DetectionPolicy detection) {
            this.detection = detection;
            return this;
        }

        public Builder timing(TimingPolicy timing) {
            this.timing = timing;
            return this;
        }

        public Builder recovery(RecoveryPolicy recovery) {
            this.recovery = recovery;
            return this;
        }

        public Builder adaptive(AdaptivePolicy adaptive) {
            this.adaptive = adaptive;
            return this;
        }

        public Builder features(BreakerFeatures features) {
            this.features = features;
            return this;
        }

        /**
         * BreakerConfig 생성.
         *
         * @return 검증된 BreakerConfig
         * @throws InvalidBreakerConfigException 불변식 위반 시
         */
        public BreakerConfig build() {
            return new BreakerConfig(breakerId, name, type, systemLayer, businessImpactTier,
                detection, timing, recovery, adaptive, features);
        }
    }
}
