package com.ryuqq.isolation.core.spi;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.SystemLayer;

import java.util.List;
import java.util.Set;

/**
 * Breaker 설정과 지표의 단일 진실 공급원 SPI.
 *
 * <p>각 breaker는 (BreakerConfig, BreakerMetrics) 쌍이며, 지표 변경은 breaker 단위의
 * 원자적 작업({@link #update})으로만 이루어집니다.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: 같은 breaker에 대한 update는 서로 끼어들지 않아야 함 (카운터 유실, stale read 금지)</li>
 *   <li>No global lock: 서로 다른 breaker의 update는 경합하지 않아야 함</li>
 *   <li>Thread-safe: 모든 메서드는 여러 스레드에서 호출 가능</li>
 *   <li>NotFound: 등록되지 않은 id는 {@link BreakerNotFoundException}</li>
 * </ul>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * register(config)   → CLOSED, 카운터 0
 * update(id, ...)    → 요청/결과/재보정이 지표를 변경
 * deregister(id)     → 제거 (자동 만료 없음)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BreakerStore {

    /**
     * Breaker 등록.
     *
     * @param config 검증된 설정
     * @throws com.ryuqq.isolation.core.config.InvalidBreakerConfigException config가 null이거나 이미 등록된 id인 경우
     */
    void register(BreakerConfig config);

    /**
     * 일관된 시점의 (config, metrics) 조회.
     *
     * @param breakerId breaker id
     * @return BreakerView
     * @throws BreakerNotFoundException 등록되지 않은 id인 경우
     */
    BreakerView get(BreakerId breakerId);

    /**
     * Breaker 락 안에서 작업 실행.
     *
     * @param breakerId breaker id
     * @param mutation 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws BreakerNotFoundException 등록되지 않은 id인 경우
     */
    <T> T update(BreakerId breakerId, BreakerMutation<T> mutation);

    /**
     * 설정 교체. 롤링 창 설정이 바뀌면 창을 재구성합니다.
     *
     * @param config 새 설정 (breakerId로 대상 식별)
     * @throws BreakerNotFoundException 등록되지 않은 id인 경우
     */
    void replaceConfig(BreakerConfig config);

    /**
     * Breaker 등록 해제.
     *
     * @param breakerId breaker id
     * @throws BreakerNotFoundException 등록되지 않은 id인 경우
     */
    void deregister(BreakerId breakerId);

    /**
     * 계층에 속한 breaker 조회.
     *
     * @param layers 대상 계층
     * @return 해당 breaker 목록 (breakerId 순)
     */
    List<BreakerView> findByLayers(Set<SystemLayer> layers);

    /**
     * 전체 breaker 조회.
     *
     * @return breaker 목록 (breakerId 순)
     */
    List<BreakerView> findAll();

    /**
     * 등록 여부 확인.
     *
     * @param breakerId breaker id
     * @return 등록되어 있으면 true
     */
    boolean contains(BreakerId breakerId);
}
