package com.ryuqq.isolation.core.coordination;

import com.ryuqq.isolation.core.model.BreakerId;

/**
 * 연속성 계획의 단계.
 *
 * <ul>
 *   <li>{@link IsolateBreaker}: 이번 조정으로 OPEN 전이한 breaker</li>
 *   <li>{@link AlreadyIsolated}: 이미 OPEN이던 breaker</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ContinuityStep permits IsolateBreaker, AlreadyIsolated {

    /**
     * 대상 breaker.
     *
     * @return BreakerId
     */
    BreakerId breakerId();

    /**
     * 사람이 읽는 단계 설명.
     *
     * @return 설명
     */
    String describe();
}
