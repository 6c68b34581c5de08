package com.ryuqq.isolation.core.spi.noop;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.spi.BreakerPersistence;
import com.ryuqq.isolation.core.spi.PersistedBreaker;

import java.util.List;

/**
 * 아무것도 저장하지 않는 {@link BreakerPersistence}.
 *
 * <p>영속화가 필요 없는 배포의 기본값입니다. 재시작 시 모든 breaker는 다시 등록되어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpBreakerPersistence implements BreakerPersistence {

    @Override
    public void saveConfig(BreakerConfig config) {
        // no-op
    }

    @Override
    public void saveState(BreakerId breakerId, BreakerState state) {
        // no-op
    }

    @Override
    public List<PersistedBreaker> loadAll() {
        return List.of();
    }

    @Override
    public void delete(BreakerId breakerId) {
        // no-op
    }
}
