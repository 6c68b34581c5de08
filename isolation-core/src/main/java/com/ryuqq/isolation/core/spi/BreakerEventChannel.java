package com.ryuqq.isolation.core.spi;

import com.ryuqq.isolation.core.event.BreakerEvent;

/**
 * 외부 관측 시스템으로 향하는 단방향 이벤트 채널 SPI.
 *
 * <p>이 모듈은 발행만 하며 구독자를 관리하지 않습니다.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Non-blocking: breaker 락 밖에서 호출되지만 요청 경로이므로 빠르게 반환해야 함</li>
 *   <li>Thread-safe</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BreakerEventChannel {

    /**
     * 이벤트 발행.
     *
     * @param event 이벤트
     * @throws IllegalArgumentException event가 null인 경우
     */
    void publish(BreakerEvent event);
}
