package com.ryuqq.isolation.core.event;

import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;

import java.util.Optional;

/**
 * 조정 격리 대상 breaker 하나의 복구 점검 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param breakerId 대상 breaker
 * @param state 점검 시점 상태 (등록 해제되었으면 empty)
 * @param recovered HALF_OPEN 또는 CLOSED로 이동했으면 true
 */
public record RecoveryCheck(
    BreakerId breakerId,
    Optional<BreakerState> state,
    boolean recovered
) {
}
