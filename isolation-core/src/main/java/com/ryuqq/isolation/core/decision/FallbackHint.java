package com.ryuqq.isolation.core.decision;

/**
 * 호출자에게 권장하는 대체 경로.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FallbackHint {

    /** 캐시 또는 대체 경로 사용 */
    USE_CACHED_OR_ALTERNATE_PATH,

    /** 예상 복구 시각 이후 재시도 */
    RETRY_AFTER_RECOVERY,

    /** 시스템 관리자에게 문의 */
    CONTACT_OPERATOR,

    /** 비상 에스컬레이션 경로 실행 */
    ESCALATE
}
