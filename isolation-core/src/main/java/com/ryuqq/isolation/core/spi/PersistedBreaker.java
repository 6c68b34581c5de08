package com.ryuqq.isolation.core.spi;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.model.BreakerState;

/**
 * 영속화된 breaker (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param config 설정
 * @param state 마지막 상태
 */
public record PersistedBreaker(
    BreakerConfig config,
    BreakerState state
) {
}
