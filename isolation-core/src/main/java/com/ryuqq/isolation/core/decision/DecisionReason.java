package com.ryuqq.isolation.core.decision;

/**
 * 허용/거부 사유 코드.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DecisionReason {

    /** CLOSED: 정상 허용 */
    CLOSED,

    /** OPEN: 재평가 시각 전 거부 */
    OPEN,

    /** OPEN이지만 매출 영향 요청이라 예외 허용 */
    OPEN_BUSINESS_OVERRIDE,

    /** HALF_OPEN: probe 요청 허용 */
    HALF_OPEN_PROBE,

    /** HALF_OPEN: probe 할당 소진으로 거부 */
    HALF_OPEN_QUOTA_EXHAUSTED,

    /** FORCE_OPEN: 운영자 강제 차단 */
    FORCED_OPEN,

    /** EMERGENCY: 외부 에스컬레이션 필요 */
    EMERGENCY_ESCALATION_REQUIRED
}
