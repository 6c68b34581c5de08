package com.ryuqq.isolation.adapter.inmemory.persistence;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.spi.BreakerPersistence;
import com.ryuqq.isolation.core.spi.PersistedBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory {@link BreakerPersistence}.
 *
 * <p>서비스 인스턴스를 새로 만들어도 이 객체를 공유하면 재시작 복원을 흉내낼 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryBreakerPersistence implements BreakerPersistence {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBreakerPersistence.class);

    private final ConcurrentHashMap<BreakerId, PersistedBreaker> records = new ConcurrentHashMap<>();

    @Override
    public void saveConfig(BreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        records.merge(
            config.breakerId(),
            new PersistedBreaker(config, BreakerState.CLOSED),
            (existing, fresh) -> new PersistedBreaker(config, existing.state())
        );
    }

    @Override
    public void saveState(BreakerId breakerId, BreakerState state) {
        if (breakerId == null || state == null) {
            throw new IllegalArgumentException("breakerId and state cannot be null");
        }
        PersistedBreaker updated = records.computeIfPresent(
            breakerId, (id, existing) -> new PersistedBreaker(existing.config(), state)
        );
        if (updated == null) {
            log.debug("Ignoring state {} for {} without saved config", state, breakerId);
        }
    }

    @Override
    public List<PersistedBreaker> loadAll() {
        return records.values().stream()
            .sorted(Comparator.comparing(record -> record.config().breakerId().getValue()))
            .collect(Collectors.toList());
    }

    @Override
    public void delete(BreakerId breakerId) {
        records.remove(breakerId);
    }

    /**
     * 저장된 breaker 수 (테스트용).
     *
     * @return 저장 수
     */
    public int size() {
        return records.size();
    }

    /**
     * 모든 기록 제거 (테스트용).
     */
    public void clear() {
        records.clear();
    }
}
