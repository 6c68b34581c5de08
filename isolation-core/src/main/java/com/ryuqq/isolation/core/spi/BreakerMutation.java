package com.ryuqq.isolation.core.spi;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.BreakerMetrics;

/**
 * Breaker 락 안에서 실행되는 읽기-수정-쓰기 작업.
 *
 * <p>구현은 I/O나 다른 breaker 락 획득 없이 빠르게 끝나야 합니다.
 * 이벤트 발행과 영속화는 반환값을 받아 락 밖에서 수행합니다.</p>
 *
 * @param <T> 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BreakerMutation<T> {

    /**
     * 작업 실행.
     *
     * @param config 현재 설정
     * @param metrics 가변 지표 (이 호출 안에서만 유효)
     * @return 결과
     */
    T apply(BreakerConfig config, BreakerMetrics metrics);
}
