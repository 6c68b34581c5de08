package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.core.model.BusinessImpactTier;
import com.ryuqq.isolation.core.model.SystemLayer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 계층 간 격리 조정 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>perBreakerTimeout: breaker 하나를 격리하는 데 허용하는 시간 (기본 2초)</li>
 *   <li>stagedTierThreshold: 대상 중 이 등급 이상이 있으면 계층별 순차 격리 (기본 CRITICAL)</li>
 *   <li>fallbackEndpoints: 계층별 대체 경로 (기본 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param perBreakerTimeout breaker별 격리 제한 시간 (양수여야 함)
 * @param stagedTierThreshold 순차 격리 기준 등급 (null이 아니어야 함)
 * @param fallbackEndpoints 계층별 대체 경로 (null이 아니어야 함)
 */
public record CoordinatorConfig(
    Duration perBreakerTimeout,
    BusinessImpactTier stagedTierThreshold,
    Map<SystemLayer, List<String>> fallbackEndpoints
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: perBreakerTimeout=2s, stagedTierThreshold=CRITICAL, fallbackEndpoints 없음</p>
     */
    public CoordinatorConfig() {
        this(Duration.ofSeconds(2), BusinessImpactTier.CRITICAL, Map.of());
    }

    /**
     * Compact constructor (유효성 검증 및 방어적 복사).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (perBreakerTimeout == null || perBreakerTimeout.isZero() || perBreakerTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "perBreakerTimeout must be positive (current: " + perBreakerTimeout + ")"
            );
        }
        if (stagedTierThreshold == null) {
            throw new IllegalArgumentException("stagedTierThreshold cannot be null");
        }
        if (fallbackEndpoints == null) {
            throw new IllegalArgumentException("fallbackEndpoints cannot be null");
        }
        Map<SystemLayer, List<String>> copy = new EnumMap<>(SystemLayer.class);
        fallbackEndpoints.forEach((layer, endpoints) -> copy.put(layer, List.copyOf(endpoints)));
        fallbackEndpoints = Map.copyOf(copy);
    }

    /**
     * 대상 계층들의 대체 경로 (계층 순서, 중복 제거).
     *
     * @param layers 격리 대상 계층
     * @return 대체 경로 목록
     */
    public List<String> fallbacksFor(Set<SystemLayer> layers) {
        Set<String> endpoints = new LinkedHashSet<>();
        for (SystemLayer layer : new TreeSet<>(layers)) {
            endpoints.addAll(fallbackEndpoints.getOrDefault(layer, List.of()));
        }
        return List.copyOf(endpoints);
    }

    /**
     * perBreakerTimeout만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withPerBreakerTimeout(Duration perBreakerTimeout) {
        return new CoordinatorConfig(perBreakerTimeout, stagedTierThreshold, fallbackEndpoints);
    }

    /**
     * stagedTierThreshold만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withStagedTierThreshold(BusinessImpactTier stagedTierThreshold) {
        return new CoordinatorConfig(perBreakerTimeout, stagedTierThreshold, fallbackEndpoints);
    }

    /**
     * 한 계층의 대체 경로를 지정한 새 인스턴스 생성.
     */
    public CoordinatorConfig withFallbackEndpoints(SystemLayer layer, List<String> endpoints) {
        Map<SystemLayer, List<String>> updated = new EnumMap<>(SystemLayer.class);
        updated.putAll(fallbackEndpoints);
        updated.put(layer, endpoints);
        return new CoordinatorConfig(perBreakerTimeout, stagedTierThreshold, updated);
    }
}
