package com.ryuqq.isolation.core.coordination;

import com.ryuqq.isolation.core.model.BreakerId;

/**
 * 조정 격리에서 전이하지 못한 breaker (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param breakerId 대상 breaker
 * @param reason 실패 사유
 */
public record CoordinationFailure(
    BreakerId breakerId,
    String reason
) {
}
