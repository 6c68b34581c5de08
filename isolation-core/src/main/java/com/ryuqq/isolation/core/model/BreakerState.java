package com.ryuqq.isolation.core.model;

/**
 * Circuit breaker 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <pre>
 * CLOSED ──threshold──→ OPEN ──openDuration──→ HALF_OPEN ──probes ok──→ CLOSED
 *                        ↑                         │
 *                        └────── probe failed ─────┘
 *
 * any ──operator──→ FORCE_OPEN ──revert / expiry──→ CLOSED
 * any ──critical failure──→ EMERGENCY ──external recovery──→ HALF_OPEN
 * </pre>
 *
 * <p>FORCE_OPEN과 EMERGENCY는 감지기 신호로는 빠져나갈 수 없고
 * 명시적인 외부 조치가 필요합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum BreakerState {

    /** 정상: 모든 요청 허용 */
    CLOSED,

    /** 차단: openDuration 경과 전까지 요청 거부 */
    OPEN,

    /** 시험: 제한된 수의 probe 요청만 허용 */
    HALF_OPEN,

    /** 운영자 강제 차단 */
    FORCE_OPEN,

    /** 비상 차단: 외부 에스컬레이션 필요 */
    EMERGENCY;

    /**
     * 요청을 차단하는 상태인지 확인 (OPEN, FORCE_OPEN, EMERGENCY).
     *
     * @return 차단 상태이면 true
     */
    public boolean isIsolating() {
        return this == OPEN || this == FORCE_OPEN || this == EMERGENCY;
    }

    /**
     * 외부 조치 없이는 빠져나갈 수 없는 상태인지 확인 (FORCE_OPEN, EMERGENCY).
     *
     * @return 수동 제어 상태이면 true
     */
    public boolean isManuallyControlled() {
        return this == FORCE_OPEN || this == EMERGENCY;
    }
}
