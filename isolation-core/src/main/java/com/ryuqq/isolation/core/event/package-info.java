/**
 * 외부로 내보내는 이벤트 타입.
 *
 * <p>이벤트는 {@link com.ryuqq.isolation.core.spi.BreakerEventChannel}로 발행되며,
 * 구독자 상태는 이 모듈이 보관하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.event;
