package com.ryuqq.isolation.core.model;

/**
 * Breaker의 보호 범위 분류.
 *
 * <p>동작에는 영향을 주지 않으며 상태 조회와 이벤트에서 운영자에게 노출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BreakerType {
    /** 단일 서비스 의존성 보호 */
    SERVICE_LEVEL,
    /** 서브시스템 전체 보호 */
    SYSTEM_LEVEL,
    /** 비즈니스 기능 단위 보호 */
    BUSINESS_LEVEL,
    /** 여러 시스템에 걸친 의존성 보호 */
    CROSS_SYSTEM,
    /** 비상 차단 전용 */
    EMERGENCY
}
