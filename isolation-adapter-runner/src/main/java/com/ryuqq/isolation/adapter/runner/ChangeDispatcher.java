package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.event.BreakerEvent;
import com.ryuqq.isolation.core.event.StateTransitionEvent;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.spi.BreakerEventChannel;
import com.ryuqq.isolation.core.spi.BreakerPersistence;
import com.ryuqq.isolation.core.spi.PersistedBreaker;
import com.ryuqq.isolation.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 상태 변경의 외부 전파 (이벤트 발행 + 영속화).
 *
 * <p><strong>전이 전파 순서:</strong></p>
 * <pre>
 * 1. breaker 락 안에서 enqueue(config, transition) → breaker별 대기열에 전이 순서대로 추가
 * 2. 락 해제 후 flush(breakerId) → 대기열을 순서대로 로깅, 이벤트 발행, 상태 저장
 * </pre>
 *
 * <p>breaker별 배출 락을 잡은 스레드 하나만 대기열을 비우므로, 락 해제 후 스레드 실행 순서와
 * 관계없이 이벤트와 저장 상태는 전이 순서를 따릅니다. 배출 락을 얻지 못한 스레드의 전이는
 * 배출 중인 스레드가 이어서 전파합니다.</p>
 *
 * <p>이벤트 채널이나 영속화 저장소의 장애는 경고로 남기고 삼키므로 판정 경로로 전파되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ChangeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ChangeDispatcher.class);
    private final BreakerEventChannel channel;
    private final BreakerPersistence persistence;
    private final Map<BreakerId, PendingTransitions> pending = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param channel 이벤트 채널
     * @param persistence 영속화 저장소
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ChangeDispatcher(BreakerEventChannel channel, BreakerPersistence persistence) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (persistence == null) {
            throw new IllegalArgumentException("persistence cannot be null");
        }
        this.channel = channel;
        this.persistence = persistence;
    }

    /**
     * 전파 대기열에 전이 추가. breaker 락 안에서 호출해야 합니다.
     *
     * @param config 전이한 breaker 설정
     * @param transition 전이
     */
    public void enqueue(BreakerConfig config, StateTransition transition) {
        pending.computeIfAbsent(config.breakerId(), id -> new PendingTransitions())
            .queue.add(new Pending(config, transition));
    }

    /**
     * 대기 중인 전이를 순서대로 전파. breaker 락 해제 후 호출합니다.
     *
     * @param breakerId 대상 breaker
     */
    public void flush(BreakerId breakerId) {
        PendingTransitions transitions = pending.get(breakerId);
        if (transitions == null) {
            return;
        }
        while (!transitions.queue.isEmpty()) {
            if (!transitions.drainLock.tryLock()) {
                return;
            }
            try {
                Pending next;
                while ((next = transitions.queue.poll()) != null) {
                    dispatch(next.config(), next.transition());
                }
            } finally {
                transitions.drainLock.unlock();
            }
        }
    }

    private void dispatch(BreakerConfig config, StateTransition transition) {
        BreakerId breakerId = config.breakerId();
        if (transition.to() == BreakerState.EMERGENCY) {
            log.warn("Breaker {} escalated {} -> EMERGENCY: {}", breakerId, transition.from(), transition.reason());
        } else {
            log.info("Breaker {} transitioned {} -> {} ({}): {}",
                breakerId, transition.from(), transition.to(), transition.signal(), transition.reason());
        }

        publish(new StateTransitionEvent(breakerId, config.name(), config.systemLayer(), transition));

        try {
            persistence.saveState(breakerId, transition.to());
        } catch (Exception e) {
            log.warn("Failed to persist state {} for breaker {}", transition.to(), breakerId, e);
        }
    }

    /**
     * 이벤트 발행.
     *
     * @param event 이벤트
     */
    public void publish(BreakerEvent event) {
        try {
            channel.publish(event);
        } catch (Exception e) {
            log.warn("Failed to publish event {}", event, e);
        }
    }

    /**
     * 설정 저장.
     *
     * @param config 저장할 설정
     */
    public void configSaved(BreakerConfig config) {
        try {
            persistence.saveConfig(config);
        } catch (Exception e) {
            log.warn("Failed to persist config for breaker {}", config.breakerId(), e);
        }
    }

    /**
     * 영속 기록 삭제.
     *
     * @param breakerId 삭제한 breaker
     */
    public void removed(BreakerId breakerId) {
        flush(breakerId);
        pending.remove(breakerId);
        try {
            persistence.delete(breakerId);
        } catch (Exception e) {
            log.warn("Failed to delete persisted breaker {}", breakerId, e);
        }
    }

    /**
     * 영속 기록 전체 조회.
     *
     * @return 저장된 breaker 목록 (조회 실패 시 빈 목록)
     */
    public List<PersistedBreaker> loadAll() {
        try {
            return persistence.loadAll();
        } catch (Exception e) {
            log.warn("Failed to load persisted breakers, starting with none", e);
            return List.of();
        }
    }

    private record Pending(BreakerConfig config, StateTransition transition) {
    }

    private static final class PendingTransitions {
        private final Queue<Pending> queue = new ConcurrentLinkedQueue<>();
        private final ReentrantLock drainLock = new ReentrantLock();
    }
}
