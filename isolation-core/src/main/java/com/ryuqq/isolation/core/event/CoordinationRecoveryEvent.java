package com.ryuqq.isolation.core.event;

import com.ryuqq.isolation.core.model.BreakerId;

import java.time.Instant;
import java.util.List;

/**
 * 조정 격리 후 복구 점검 이벤트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param coordinationId 조정 식별자
 * @param triggerBreakerId 조정을 요청한 breaker
 * @param checks breaker별 점검 결과
 * @param checkedAt 점검 시각
 */
public record CoordinationRecoveryEvent(
    String coordinationId,
    BreakerId triggerBreakerId,
    List<RecoveryCheck> checks,
    Instant checkedAt
) implements BreakerEvent {

    /**
     * Compact constructor (방어적 복사).
     */
    public CoordinationRecoveryEvent {
        checks = List.copyOf(checks);
    }

    @Override
    public Instant occurredAt() {
        return checkedAt;
    }

    /**
     * 모든 대상이 복구되었는지 확인.
     *
     * @return 모두 recovered이면 true
     */
    public boolean fullyRecovered() {
        return checks.stream().allMatch(RecoveryCheck::recovered);
    }
}
