package com.ryuqq.isolation.adapter.inmemory.event;

import com.ryuqq.isolation.core.event.BreakerEvent;
import com.ryuqq.isolation.core.spi.BreakerEventChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 용량 제한 큐 기반 {@link BreakerEventChannel}.
 *
 * <p>외부 소비자가 {@link #drain()}으로 이벤트를 가져갑니다.
 * 큐가 가득 차면 가장 오래된 이벤트를 버리고 경고를 남기므로
 * 발행자는 소비자 속도에 막히지 않습니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 모든 메서드는 이 객체의 모니터로 동기화됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryBreakerEventChannel implements BreakerEventChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBreakerEventChannel.class);

    /** 기본 용량 */
    public static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final Deque<BreakerEvent> queue;
    private long dropped;

    /**
     * 기본 용량으로 생성.
     */
    public InMemoryBreakerEventChannel() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * 생성자.
     *
     * @param capacity 최대 보관 이벤트 수
     * @throws IllegalArgumentException capacity가 1 미만인 경우
     */
    public InMemoryBreakerEventChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>();
    }

    @Override
    public synchronized void publish(BreakerEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (queue.size() >= capacity) {
            BreakerEvent oldest = queue.pollFirst();
            dropped++;
            log.warn("Event channel full (capacity {}), dropped oldest event: {}", capacity, oldest);
        }
        queue.addLast(event);
    }

    /**
     * 쌓인 이벤트를 모두 꺼냄.
     *
     * @return 발행 순서대로의 이벤트
     */
    public synchronized List<BreakerEvent> drain() {
        List<BreakerEvent> drained = new ArrayList<>(queue);
        queue.clear();
        return drained;
    }

    /**
     * 쌓인 이벤트 조회 (꺼내지 않음).
     *
     * @return 발행 순서대로의 이벤트
     */
    public synchronized List<BreakerEvent> events() {
        return List.copyOf(queue);
    }

    /**
     * 특정 타입의 쌓인 이벤트 조회 (꺼내지 않음).
     *
     * @param type 이벤트 타입
     * @param <T> 이벤트 타입
     * @return 발행 순서대로의 이벤트
     */
    public synchronized <T extends BreakerEvent> List<T> eventsOf(Class<T> type) {
        return queue.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    /**
     * 쌓인 이벤트 수.
     *
     * @return 이벤트 수
     */
    public synchronized int size() {
        return queue.size();
    }

    /**
     * 용량 초과로 버린 이벤트 수.
     *
     * @return 버린 수
     */
    public synchronized long droppedCount() {
        return dropped;
    }

    /**
     * 모든 이벤트와 카운터 초기화 (테스트용).
     */
    public synchronized void clear() {
        queue.clear();
        dropped = 0;
    }
}
