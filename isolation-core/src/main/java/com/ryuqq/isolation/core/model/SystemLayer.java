package com.ryuqq.isolation.core.model;

/**
 * Breaker가 보호하는 논리적 서브시스템 계층.
 *
 * <p>선언 순서는 요청이 바깥에서 안쪽으로 흐르는 순서이며,
 * 단계적(STAGED) 조정 격리 시 이 순서대로 계층을 하나씩 격리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SystemLayer {
    PRESENTATION,
    API,
    BUSINESS_LOGIC,
    DATA_ACCESS,
    EXTERNAL_SERVICES,
    INFRASTRUCTURE,
    SECURITY,
    MONITORING,
    AI_ML,
    SERVICE_MESH
}
