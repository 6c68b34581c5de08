package com.ryuqq.isolation.core.coordination;

import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.SystemLayer;

import java.time.Instant;

/**
 * 조정 시점에 이미 OPEN이던 단계.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param breakerId 대상 breaker
 * @param name breaker 이름
 * @param layer breaker 계층
 * @param reopensAt 기존 재평가 가능 시각
 */
public record AlreadyIsolated(
    BreakerId breakerId,
    String name,
    SystemLayer layer,
    Instant reopensAt
) implements ContinuityStep {

    @Override
    public String describe() {
        return String.format("Keep %s (%s) at layer %s isolated, already OPEN until %s",
            name, breakerId.getValue(), layer, reopensAt);
    }
}
