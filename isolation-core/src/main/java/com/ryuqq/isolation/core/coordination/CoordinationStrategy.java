package com.ryuqq.isolation.core.coordination;

/**
 * 조정 격리 실행 방식.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CoordinationStrategy {

    /** 모든 대상 breaker를 동시에 격리 */
    PARALLEL,

    /** 계층 순서대로 한 계층씩 격리 */
    STAGED
}
