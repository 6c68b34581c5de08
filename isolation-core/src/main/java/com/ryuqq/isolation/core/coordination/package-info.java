/**
 * 조정 격리 결과 타입.
 *
 * <p>연속성 계획은 {@link com.ryuqq.isolation.core.coordination.ContinuityStep} variant의 순서 있는 목록이며,
 * 대상 breaker 하나당 한 단계입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.coordination;
