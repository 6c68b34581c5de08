package com.ryuqq.isolation.core.config;

import com.ryuqq.isolation.core.model.BusinessImpactTier;
import com.ryuqq.isolation.core.model.SystemLayer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Breaker 기능 플래그 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>adaptiveThresholds: 적응형 임계값 사용 (기본 false)</li>
 *   <li>crossSystemCoordination: OPEN 전이 시 coordinatedLayers 조정 격리 (기본 false)</li>
 *   <li>emergencyEscalation: emergencyTier 이상 실패 시 EMERGENCY 전이 (기본 false)</li>
 *   <li>businessAwareBreaking: OPEN 상태에서 매출 영향 요청 예외 허용 (기본 false)</li>
 *   <li>emergencyTier: 비상 에스컬레이션 기준 등급 (기본 CRITICAL)</li>
 *   <li>coordinatedLayers: 이 breaker가 열릴 때 함께 격리할 계층 (기본 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param adaptiveThresholds 적응형 임계값 사용
 * @param crossSystemCoordination 조정 격리 사용
 * @param emergencyEscalation 비상 에스컬레이션 사용
 * @param businessAwareBreaking 비즈니스 인지 차단 사용
 * @param emergencyTier 비상 기준 등급
 * @param coordinatedLayers 함께 격리할 계층
 */
public record BreakerFeatures(
    boolean adaptiveThresholds,
    boolean crossSystemCoordination,
    boolean emergencyEscalation,
    boolean businessAwareBreaking,
    BusinessImpactTier emergencyTier,
    Set<SystemLayer> coordinatedLayers
) {

    /**
     * 기본 설정 생성자 (모든 기능 off).
     */
    public BreakerFeatures() {
        this(false, false, false, false, BusinessImpactTier.CRITICAL, Set.of());
    }

    /**
     * Compact constructor (유효성 검증, 방어적 복사).
     *
     * @throws InvalidBreakerConfigException 파라미터 검증 실패 시
     */
    public BreakerFeatures {
        ConfigChecks.requireNonNull(emergencyTier, "emergencyTier");
        ConfigChecks.requireNonNull(coordinatedLayers, "coordinatedLayers");
        coordinatedLayers = coordinatedLayers.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(coordinatedLayers));
    }

    public BreakerFeatures withAdaptiveThresholds(boolean adaptiveThresholds) {
        return new BreakerFeatures(adaptiveThresholds, crossSystemCoordination, emergencyEscalation,
            businessAwareBreaking, emergencyTier, coordinatedLayers);
    }

    public BreakerFeatures withCoordination(Set<SystemLayer> coordinatedLayers) {
        return new BreakerFeatures(adaptiveThresholds, true, emergencyEscalation,
            businessAwareBreaking, emergencyTier, coordinatedLayers);
    }

    public BreakerFeatures withEmergencyEscalation(BusinessImpactTier emergencyTier) {
        return new BreakerFeatures(adaptiveThresholds, crossSystemCoordination, true,
            businessAwareBreaking, emergencyTier, coordinatedLayers);
    }

    public BreakerFeatures withBusinessAwareBreaking(boolean businessAwareBreaking) {
        return new BreakerFeatures(adaptiveThresholds, crossSystemCoordination, emergencyEscalation,
            businessAwareBreaking, emergencyTier, coordinatedLayers);
    }
}
