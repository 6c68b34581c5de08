package com.ryuqq.isolation.core.model;

/**
 * 장애의 비즈니스 영향 등급 (서수형).
 *
 * <p>외부 분류기가 제공하는 값이며, 이 모듈은 계산하지 않고 비교만 합니다.
 * 선언 순서가 곧 심각도 순서입니다: MINIMAL &lt; LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL &lt; REVENUE_BLOCKING.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BusinessImpactTier {
    MINIMAL,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL,
    REVENUE_BLOCKING;

    /**
     * 이 등급이 주어진 등급 이상인지 확인.
     *
     * @param other 비교 대상 등급
     * @return this &gt;= other 이면 true
     * @throws IllegalArgumentException other가 null인 경우
     */
    public boolean isAtLeast(BusinessImpactTier other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return this.ordinal() >= other.ordinal();
    }
}
