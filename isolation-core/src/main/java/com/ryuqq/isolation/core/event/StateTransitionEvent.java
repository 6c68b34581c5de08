package com.ryuqq.isolation.core.event;

import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.SystemLayer;
import com.ryuqq.isolation.core.statemachine.StateTransition;

import java.time.Instant;

/**
 * 상태 전이 이벤트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param breakerId 대상 breaker
 * @param name breaker 이름
 * @param layer breaker 계층
 * @param transition 전이 기록
 */
public record StateTransitionEvent(
    BreakerId breakerId,
    String name,
    SystemLayer layer,
    StateTransition transition
) implements BreakerEvent {

    @Override
    public Instant occurredAt() {
        return transition.at();
    }
}
