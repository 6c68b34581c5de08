package com.ryuqq.isolation.core.coordination;

import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.model.SystemLayer;

import java.time.Instant;

/**
 * 조정으로 OPEN 전이한 단계.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param breakerId 대상 breaker
 * @param name breaker 이름
 * @param layer breaker 계층
 * @param previousState 전이 전 상태
 * @param reopensAt 재평가 가능 시각
 */
public record IsolateBreaker(
    BreakerId breakerId,
    String name,
    SystemLayer layer,
    BreakerState previousState,
    Instant reopensAt
) implements ContinuityStep {

    @Override
    public String describe() {
        return String.format("Isolate %s (%s) at layer %s: %s -> OPEN until %s",
            name, breakerId.getValue(), layer, previousState, reopensAt);
    }
}
