package com.ryuqq.isolation.core.event;

import java.time.Instant;

/**
 * 외부 관측 시스템으로 내보내는 이벤트.
 *
 * <ul>
 *   <li>{@link StateTransitionEvent}: 모든 상태 전이</li>
 *   <li>{@link CoordinationEvent}: 조정 격리 완료</li>
 *   <li>{@link CoordinationRecoveryEvent}: 조정 격리 후 복구 점검 결과</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface BreakerEvent
    permits StateTransitionEvent, CoordinationEvent, CoordinationRecoveryEvent {

    /**
     * 이벤트 발생 시각.
     *
     * @return 발생 시각
     */
    Instant occurredAt();
}
