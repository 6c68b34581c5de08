package com.ryuqq.isolation.core.status;

/**
 * 상태 조회용 건강 수준.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum HealthLevel {
    /** CLOSED */
    HEALTHY,
    /** HALF_OPEN */
    RECOVERING,
    /** OPEN, FORCE_OPEN */
    ISOLATED,
    /** EMERGENCY, 또는 CRITICAL 이상 등급 breaker의 격리 */
    CRITICAL
}
