package com.ryuqq.isolation.core.spi;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;

import java.util.List;

/**
 * 프로세스 재시작 간 breaker 설정과 마지막 상태를 보존하는 선택적 SPI.
 *
 * <p>저장 형식은 구현이 결정합니다. 호출은 항상 breaker 락 밖에서 이루어지며,
 * 구현이 예외를 던지면 호출자는 로그를 남기고 계속 진행합니다
 * (복원 실패 시 breaker는 CLOSED로 시작).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BreakerPersistence {

    /**
     * 설정 저장 (등록, 설정 변경 시).
     *
     * @param config 설정
     */
    void saveConfig(BreakerConfig config);

    /**
     * 마지막 상태 저장 (전이 시).
     *
     * @param breakerId breaker id
     * @param state 상태
     */
    void saveState(BreakerId breakerId, BreakerState state);

    /**
     * 저장된 전체 breaker 조회.
     *
     * @return 저장된 breaker 목록
     */
    List<PersistedBreaker> loadAll();

    /**
     * 저장된 breaker 삭제 (등록 해제 시).
     *
     * @param breakerId breaker id
     */
    void delete(BreakerId breakerId);
}
