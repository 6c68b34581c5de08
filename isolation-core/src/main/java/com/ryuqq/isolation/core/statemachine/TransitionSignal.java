package com.ryuqq.isolation.core.statemachine;

/**
 * 상태 전이를 일으키는 신호.
 *
 * <p>어떤 (상태, 신호) 쌍이 허용되는지는 {@link BreakerTransitions}가 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TransitionSignal {

    /** 실패율이 유효 임계값 이상 (CLOSED → OPEN) */
    THRESHOLD_BREACHED,

    /** openDuration 경과 (OPEN → HALF_OPEN) */
    OPEN_TIMEOUT_ELAPSED,

    /** 헬스 probe 성공 + 재평가 시각 도달 (OPEN → HALF_OPEN) */
    HEALTH_PROBE_PASSED,

    /** 연속 성공이 successThreshold 도달 (HALF_OPEN → CLOSED) */
    PROBES_SUCCEEDED,

    /** probe 창에서 실패 발생 (HALF_OPEN → OPEN) */
    PROBE_FAILED,

    /** 다른 breaker가 요청한 조정 격리 (CLOSED, HALF_OPEN → OPEN) */
    COORDINATED_ISOLATION,

    /** 운영자 강제 차단 (any → FORCE_OPEN) */
    OPERATOR_FORCE_OPEN,

    /** 운영자 강제 차단 해제 (FORCE_OPEN → CLOSED) */
    OPERATOR_REVERT,

    /** 강제 차단 자동 해제 타이머 만료 (FORCE_OPEN → CLOSED) */
    FORCE_OPEN_EXPIRED,

    /** 비상 등급 실패 (EMERGENCY 외 any → EMERGENCY) */
    EMERGENCY_ESCALATION,

    /** 외부 복구 신호 (EMERGENCY → HALF_OPEN) */
    EMERGENCY_RESOLVED,

    /** 운영자 초기화 (any → CLOSED) */
    OPERATOR_RESET,

    /** 영속 상태 복원 (등록 직후 CLOSED → 저장된 상태) */
    RESTORED
}
