package com.ryuqq.isolation.core.event;

import com.ryuqq.isolation.core.coordination.CoordinatedResponse;

import java.time.Instant;

/**
 * 조정 격리 완료 이벤트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param response 조정 결과
 */
public record CoordinationEvent(
    CoordinatedResponse response
) implements BreakerEvent {

    @Override
    public Instant occurredAt() {
        return response.startedAt();
    }
}
