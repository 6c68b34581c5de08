package com.ryuqq.isolation.core.statemachine;

import com.ryuqq.isolation.core.model.BreakerState;

/**
 * Breaker 상태 전이 함수: (현재 상태, 신호) → 다음 상태.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED --THRESHOLD_BREACHED--&gt; OPEN</li>
 *   <li>OPEN --OPEN_TIMEOUT_ELAPSED / HEALTH_PROBE_PASSED--&gt; HALF_OPEN</li>
 *   <li>HALF_OPEN --PROBES_SUCCEEDED--&gt; CLOSED</li>
 *   <li>HALF_OPEN --PROBE_FAILED--&gt; OPEN</li>
 *   <li>CLOSED, HALF_OPEN --COORDINATED_ISOLATION--&gt; OPEN</li>
 *   <li>any --OPERATOR_FORCE_OPEN--&gt; FORCE_OPEN</li>
 *   <li>FORCE_OPEN --OPERATOR_REVERT / FORCE_OPEN_EXPIRED--&gt; CLOSED</li>
 *   <li>EMERGENCY 외 any --EMERGENCY_ESCALATION--&gt; EMERGENCY</li>
 *   <li>EMERGENCY --EMERGENCY_RESOLVED--&gt; HALF_OPEN</li>
 *   <li>any --OPERATOR_RESET--&gt; CLOSED</li>
 *   <li>CLOSED --RESTORED--&gt; 복원 대상 상태</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>감지기 신호(THRESHOLD_BREACHED, OPEN_TIMEOUT_ELAPSED, PROBE_*, COORDINATED_ISOLATION)로는
 *       FORCE_OPEN, EMERGENCY를 벗어날 수 없음</li>
 *   <li>결과는 항상 다섯 상태 중 하나</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BreakerTransitions {

    // Utility class - prevent instantiation
    private BreakerTransitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이 허용 여부 확인.
     *
     * <p>RESTORED는 복원 대상 상태가 필요하므로 {@link #restore(BreakerState, BreakerState)}로 확인합니다.</p>
     *
     * @param from 현재 상태
     * @param signal 신호
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 signal이 null인 경우
     */
    public static boolean isPermitted(BreakerState from, TransitionSignal signal) {
        return resolve(from, signal) != null;
    }

    /**
     * 전이 대상 상태 계산.
     *
     * @param from 현재 상태
     * @param signal 신호
     * @return 다음 상태
     * @throws IllegalArgumentException from 또는 signal이 null이거나 signal이 RESTORED인 경우
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public static BreakerState target(BreakerState from, TransitionSignal signal) {
        if (signal == TransitionSignal.RESTORED) {
            throw new IllegalArgumentException("RESTORED requires a target state, use restore(from, to)");
        }
        BreakerState to = resolve(from, signal);
        if (to == null) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s --%s-->", from, signal)
            );
        }
        return to;
    }

    /**
     * 영속 상태 복원 전이 검증.
     *
     * @param from 현재 상태 (CLOSED여야 함)
     * @param to 복원할 상태
     * @return to
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException from이 CLOSED가 아닌 경우
     */
    public static BreakerState restore(BreakerState from, BreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from != BreakerState.CLOSED) {
            throw new IllegalStateException(
                String.format("Restore is only allowed from CLOSED: %s → %s", from, to)
            );
        }
        return to;
    }

    private static BreakerState resolve(BreakerState from, TransitionSignal signal) {
        if (from == null || signal == null) {
            throw new IllegalArgumentException("from and signal cannot be null (from: " + from + ", signal: " + signal + ")");
        }
        return switch (signal) {
            case THRESHOLD_BREACHED -> from == BreakerState.CLOSED ? BreakerState.OPEN : null;
            case OPEN_TIMEOUT_ELAPSED, HEALTH_PROBE_PASSED ->
                from == BreakerState.OPEN ? BreakerState.HALF_OPEN : null;
            case PROBES_SUCCEEDED -> from == BreakerState.HALF_OPEN ? BreakerState.CLOSED : null;
            case PROBE_FAILED -> from == BreakerState.HALF_OPEN ? BreakerState.OPEN : null;
            case COORDINATED_ISOLATION ->
                from == BreakerState.CLOSED || from == BreakerState.HALF_OPEN ? BreakerState.OPEN : null;
            case OPERATOR_FORCE_OPEN -> BreakerState.FORCE_OPEN;
            case OPERATOR_REVERT, FORCE_OPEN_EXPIRED ->
                from == BreakerState.FORCE_OPEN ? BreakerState.CLOSED : null;
            case EMERGENCY_ESCALATION -> from != BreakerState.EMERGENCY ? BreakerState.EMERGENCY : null;
            case EMERGENCY_RESOLVED -> from == BreakerState.EMERGENCY ? BreakerState.HALF_OPEN : null;
            case OPERATOR_RESET -> BreakerState.CLOSED;
            case RESTORED -> null;
        };
    }
}
