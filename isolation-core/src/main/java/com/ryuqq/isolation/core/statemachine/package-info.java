/**
 * Breaker 상태 머신.
 *
 * <p>{@link com.ryuqq.isolation.core.statemachine.BreakerTransitions}는 순수 전이 함수이고,
 * 실제 전이 적용(이력 기록, 카운터 초기화)은
 * {@link com.ryuqq.isolation.core.metrics.BreakerMetrics#transition}이 breaker 락 안에서 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.statemachine;
