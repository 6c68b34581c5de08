package com.ryuqq.isolation.core.statemachine;

import com.ryuqq.isolation.core.model.BreakerState;

import java.time.Instant;

/**
 * 상태 전이 감사 기록 (불변 record).
 *
 * <p>Breaker별 이력에 append-only로 쌓이며 시간 순서가 보장됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param from 이전 상태
 * @param to 다음 상태
 * @param signal 전이 신호
 * @param at 전이 시각
 * @param reason 사람이 읽는 사유
 * @param trigger 전이 시점 지표
 */
public record StateTransition(
    BreakerState from,
    BreakerState to,
    TransitionSignal signal,
    Instant at,
    String reason,
    TriggerMetrics trigger
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public StateTransition {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to cannot be null");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        if (reason == null) {
            reason = "";
        }
    }
}
