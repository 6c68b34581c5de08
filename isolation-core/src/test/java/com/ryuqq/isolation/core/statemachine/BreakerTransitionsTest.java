package com.ryuqq.isolation.core.statemachine;

import com.ryuqq.isolation.core.model.BreakerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.isolation.core.model.BreakerState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * BreakerTransitions 테스트.
 *
 * <ul>
 *   <li>정상 전이 (CLOSED → OPEN → HALF_OPEN → CLOSED)</li>
 *   <li>감지 신호는 FORCE_OPEN / EMERGENCY를 벗어나지 못함</li>
 *   <li>운영자 신호는 모든 상태에서 허용</li>
 *   <li>RESTORED는 CLOSED에서만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BreakerTransitionsTest {

    // ========== 정상 전이 ==========

    @Test
    void target_NormalRecoveryCycle_Succeeds() {
        BreakerState state = CLOSED;

        state = BreakerTransitions.target(state, TransitionSignal.THRESHOLD_BREACHED);
        assertEquals(OPEN, state);

        state = BreakerTransitions.target(state, TransitionSignal.OPEN_TIMEOUT_ELAPSED);
        assertEquals(HALF_OPEN, state);

        state = BreakerTransitions.target(state, TransitionSignal.PROBES_SUCCEEDED);
        assertEquals(CLOSED, state);
    }

    @Test
    void target_ProbeFailed_ReopensFromHalfOpen() {
        assertEquals(OPEN, BreakerTransitions.target(HALF_OPEN, TransitionSignal.PROBE_FAILED));
    }

    @Test
    void target_HealthProbePassed_MovesOpenToHalfOpen() {
        assertEquals(HALF_OPEN, BreakerTransitions.target(OPEN, TransitionSignal.HEALTH_PROBE_PASSED));
    }

    @Test
    void target_CoordinatedIsolation_FromClosedAndHalfOpenOnly() {
        assertEquals(OPEN, BreakerTransitions.target(CLOSED, TransitionSignal.COORDINATED_ISOLATION));
        assertEquals(OPEN, BreakerTransitions.target(HALF_OPEN, TransitionSignal.COORDINATED_ISOLATION));
        assertFalse(BreakerTransitions.isPermitted(OPEN, TransitionSignal.COORDINATED_ISOLATION));
        assertFalse(BreakerTransitions.isPermitted(FORCE_OPEN, TransitionSignal.COORDINATED_ISOLATION));
        assertFalse(BreakerTransitions.isPermitted(EMERGENCY, TransitionSignal.COORDINATED_ISOLATION));
    }

    @Test
    void target_EmergencyResolved_MovesToHalfOpen() {
        assertEquals(HALF_OPEN, BreakerTransitions.target(EMERGENCY, TransitionSignal.EMERGENCY_RESOLVED));
    }

    @Test
    void target_ForceOpenRevertAndExpiry_MoveToClosed() {
        assertEquals(CLOSED, BreakerTransitions.target(FORCE_OPEN, TransitionSignal.OPERATOR_REVERT));
        assertEquals(CLOSED, BreakerTransitions.target(FORCE_OPEN, TransitionSignal.FORCE_OPEN_EXPIRED));
    }

    // ========== 운영자 신호 ==========

    @ParameterizedTest
    @EnumSource(BreakerState.class)
    void target_OperatorForceOpenAndReset_AllowedFromAnyState(BreakerState from) {
        assertEquals(FORCE_OPEN, BreakerTransitions.target(from, TransitionSignal.OPERATOR_FORCE_OPEN));
        assertEquals(CLOSED, BreakerTransitions.target(from, TransitionSignal.OPERATOR_RESET));
    }

    @ParameterizedTest
    @EnumSource(value = BreakerState.class, names = "EMERGENCY", mode = EnumSource.Mode.EXCLUDE)
    void target_EmergencyEscalation_AllowedFromAnyOtherState(BreakerState from) {
        assertEquals(EMERGENCY, BreakerTransitions.target(from, TransitionSignal.EMERGENCY_ESCALATION));
    }

    // ========== 금지된 전이 ==========

    @ParameterizedTest
    @EnumSource(value = BreakerState.class, names = {"FORCE_OPEN", "EMERGENCY"})
    void target_DetectorSignals_NeverLeaveOperatorStates(BreakerState from) {
        for (TransitionSignal signal : new TransitionSignal[]{
            TransitionSignal.THRESHOLD_BREACHED,
            TransitionSignal.OPEN_TIMEOUT_ELAPSED,
            TransitionSignal.HEALTH_PROBE_PASSED,
            TransitionSignal.PROBES_SUCCEEDED,
            TransitionSignal.PROBE_FAILED,
            TransitionSignal.COORDINATED_ISOLATION
        }) {
            assertFalse(BreakerTransitions.isPermitted(from, signal), from + " --" + signal);
        }
    }

    @Test
    void target_InvalidTransition_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> BreakerTransitions.target(CLOSED, TransitionSignal.PROBES_SUCCEEDED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void target_EmergencyToEmergency_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> BreakerTransitions.target(EMERGENCY, TransitionSignal.EMERGENCY_ESCALATION));
    }

    @Test
    void target_NullArguments_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> BreakerTransitions.target(null, TransitionSignal.THRESHOLD_BREACHED));
        assertThrows(IllegalArgumentException.class,
            () -> BreakerTransitions.target(CLOSED, null));
    }

    // ========== 복원 ==========

    @Test
    void restore_FromClosed_ReturnsPersistedState() {
        assertEquals(EMERGENCY, BreakerTransitions.restore(CLOSED, EMERGENCY));
        assertEquals(OPEN, BreakerTransitions.restore(CLOSED, OPEN));
    }

    @Test
    void restore_FromOtherState_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> BreakerTransitions.restore(OPEN, FORCE_OPEN));
    }

    @Test
    void target_RestoredSignal_RequiresRestore() {
        assertThrows(IllegalArgumentException.class,
            () -> BreakerTransitions.target(CLOSED, TransitionSignal.RESTORED));
        assertFalse(BreakerTransitions.isPermitted(CLOSED, TransitionSignal.RESTORED));
    }
}
