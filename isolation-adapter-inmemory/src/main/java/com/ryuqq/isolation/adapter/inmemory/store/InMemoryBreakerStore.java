package com.ryuqq.isolation.adapter.inmemory.store;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.config.DetectionPolicy;
import com.ryuqq.isolation.core.config.InvalidBreakerConfigException;
import com.ryuqq.isolation.core.metrics.BreakerMetrics;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.SystemLayer;
import com.ryuqq.isolation.core.spi.BreakerMutation;
import com.ryuqq.isolation.core.spi.BreakerNotFoundException;
import com.ryuqq.isolation.core.spi.BreakerStore;
import com.ryuqq.isolation.core.spi.BreakerView;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link BreakerStore} SPI.
 *
 * <p>Breaker마다 독립된 {@link ReentrantLock}을 두어 같은 breaker에 대한 작업만 직렬화하고,
 * 서로 다른 breaker는 경합하지 않습니다. 전역 락은 없습니다.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> ConcurrentHashMap&lt;BreakerId, Entry&gt; - O(1) 조회, 등록/해제는 키 단위 원자적</li>
 *   <li><strong>Entry.lock:</strong> breaker별 ReentrantLock - update/get/replaceConfig 직렬화</li>
 *   <li><strong>Entry.removed:</strong> 해제 후 락을 얻은 작업이 NotFound를 받도록 표시</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>프로세스 재시작 시 데이터 유실 (영속화는 BreakerPersistence 담당)</li>
 *   <li>단일 프로세스 안에서만 원자성 보장</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * BreakerStore store = new InMemoryBreakerStore(clock, 100);
 * store.register(config);
 *
 * boolean opened = store.update(breakerId, (config, metrics) -&gt; {
 *     metrics.recordFailure(clock.instant(), ErrorContext.unclassified());
 *     return metrics.state() == BreakerState.OPEN;
 * });
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryBreakerStore implements BreakerStore {

    private final Clock clock;
    private final int historyLimit;
    private final ConcurrentHashMap<BreakerId, Entry> entries;

    /**
     * Creates a store with the system UTC clock and the default history limit.
     */
    public InMemoryBreakerStore() {
        this(Clock.systemUTC(), BreakerMetrics.DEFAULT_HISTORY_LIMIT);
    }

    /**
     * 생성자.
     *
     * @param clock 시각 공급원
     * @param historyLimit breaker별 전이 이력 보관 수
     * @throws IllegalArgumentException clock이 null이거나 historyLimit이 1 미만인 경우
     */
    public InMemoryBreakerStore(Clock clock, int historyLimit) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive (current: " + historyLimit + ")");
        }
        this.clock = clock;
        this.historyLimit = historyLimit;
        this.entries = new ConcurrentHashMap<>();
    }

    @Override
    public void register(BreakerConfig config) {
        if (config == null) {
            throw new InvalidBreakerConfigException("config cannot be null");
        }
        BreakerMetrics metrics = new BreakerMetrics(clock.instant(), config.detection(), historyLimit);
        Entry previous = entries.putIfAbsent(config.breakerId(), new Entry(config, metrics));
        if (previous != null) {
            throw new InvalidBreakerConfigException("Breaker already registered: " + config.breakerId());
        }
    }

    @Override
    public BreakerView get(BreakerId breakerId) {
        return update(breakerId, (config, metrics) ->
            new BreakerView(config, metrics.snapshot(clock.instant(), config.timing()))
        );
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>락은 breaker 단위이며 재진입 가능</li>
     *   <li>락을 얻은 뒤 해제 여부를 다시 확인하므로 해제된 breaker의 지표는 변경되지 않음</li>
     * </ul>
     */
    @Override
    public <T> T update(BreakerId breakerId, BreakerMutation<T> mutation) {
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }
        Entry entry = require(breakerId);
        entry.lock.lock();
        try {
            if (entry.removed) {
                throw new BreakerNotFoundException(breakerId);
            }
            return mutation.apply(entry.config, entry.metrics);
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public void replaceConfig(BreakerConfig config) {
        if (config == null) {
            throw new InvalidBreakerConfigException("config cannot be null");
        }
        Entry entry = require(config.breakerId());
        entry.lock.lock();
        try {
            if (entry.removed) {
                throw new BreakerNotFoundException(config.breakerId());
            }
            if (windowChanged(entry.config.detection(), config.detection())) {
                entry.metrics.reconfigureWindow(config.detection());
            }
            entry.config = config;
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public void deregister(BreakerId breakerId) {
        Entry entry = require(breakerId);
        entry.lock.lock();
        try {
            if (entry.removed) {
                throw new BreakerNotFoundException(breakerId);
            }
            entry.removed = true;
            entries.remove(breakerId, entry);
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public List<BreakerView> findByLayers(Set<SystemLayer> layers) {
        if (layers == null) {
            throw new IllegalArgumentException("layers cannot be null");
        }
        return snapshotAll(layers);
    }

    @Override
    public List<BreakerView> findAll() {
        return snapshotAll(null);
    }

    @Override
    public boolean contains(BreakerId breakerId) {
        return breakerId != null && entries.containsKey(breakerId);
    }

    /**
     * 등록된 breaker 수 (테스트용).
     *
     * @return breaker 수
     */
    public int size() {
        return entries.size();
    }

    /**
     * 모든 breaker 제거 (테스트용).
     */
    public void clear() {
        entries.clear();
    }

    private List<BreakerView> snapshotAll(Set<SystemLayer> layers) {
        List<Entry> matched = entries.values().stream()
            .filter(entry -> layers == null || layers.contains(entry.config.systemLayer()))
            .sorted(Comparator.comparing(entry -> entry.config.breakerId().getValue()))
            .collect(Collectors.toList());

        List<BreakerView> views = new ArrayList<>(matched.size());
        for (Entry entry : matched) {
            entry.lock.lock();
            try {
                if (!entry.removed) {
                    views.add(new BreakerView(entry.config, entry.metrics.snapshot(clock.instant(), entry.config.timing())));
                }
            } finally {
                entry.lock.unlock();
            }
        }
        return views;
    }

    private Entry require(BreakerId breakerId) {
        if (breakerId == null) {
            throw new IllegalArgumentException("breakerId cannot be null");
        }
        Entry entry = entries.get(breakerId);
        if (entry == null) {
            throw new BreakerNotFoundException(breakerId);
        }
        return entry;
    }

    private static boolean windowChanged(DetectionPolicy before, DetectionPolicy after) {
        return !before.timeWindow().equals(after.timeWindow()) || before.windowBuckets() != after.windowBuckets();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private final BreakerMetrics metrics;
        private volatile BreakerConfig config;
        private boolean removed;

        private Entry(BreakerConfig config, BreakerMetrics metrics) {
            this.config = config;
            this.metrics = metrics;
        }
    }
}
