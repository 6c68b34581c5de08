package com.ryuqq.isolation.application.operator;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.status.BreakerStatus;
import com.ryuqq.isolation.core.status.StatusSummary;

import java.time.Duration;
import java.util.List;

/**
 * 운영자/모니터링용 관리 진입점.
 *
 * <p>설정/조회 오류는 재시도 없이 즉시 호출자에게 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BreakerAdministration {

    /**
     * Breaker 등록 (CLOSED, 카운터 0).
     *
     * @param config 설정
     * @throws com.ryuqq.isolation.core.config.InvalidBreakerConfigException 중복 id 또는 설정 오류
     */
    void register(BreakerConfig config);

    /**
     * 설정 전체 교체. 검증 실패 시 기존 설정이 유지됩니다.
     *
     * @param config 새 설정
     * @throws com.ryuqq.isolation.core.spi.BreakerNotFoundException 등록되지 않은 id인 경우
     */
    void updateConfig(BreakerConfig config);

    /**
     * Breaker 등록 해제. 예약된 타이머와 복구 점검도 취소합니다.
     *
     * @param breakerId breaker id
     * @throws com.ryuqq.isolation.core.spi.BreakerNotFoundException 등록되지 않은 id인 경우
     */
    void deregister(BreakerId breakerId);

    /**
     * 강제 차단.
     *
     * @param breakerId breaker id
     * @param reason 사유
     * @param autoRevertAfter 자동 해제까지의 시간 (null이면 명시적 해제 전까지 유지)
     * @throws com.ryuqq.isolation.core.spi.BreakerNotFoundException 등록되지 않은 id인 경우
     */
    void forceOpen(BreakerId breakerId, String reason, Duration autoRevertAfter);

    /**
     * 강제 차단 해제 (FORCE_OPEN → CLOSED).
     *
     * @param breakerId breaker id
     * @throws IllegalStateException FORCE_OPEN이 아닌 경우
     */
    void revert(BreakerId breakerId);

    /**
     * 운영자 초기화: CLOSED로 전이하고 모든 카운터와 비즈니스 영향 집계를 초기화.
     *
     * @param breakerId breaker id
     */
    void reset(BreakerId breakerId);

    /**
     * 외부 복구 신호 (EMERGENCY → HALF_OPEN).
     *
     * @param breakerId breaker id
     * @param resolution 해결 내용
     * @throws IllegalStateException EMERGENCY가 아닌 경우
     */
    void resolveEmergency(BreakerId breakerId, String resolution);

    /**
     * 상태 조회.
     *
     * @param breakerId breaker id
     * @return (config, metrics, health)
     */
    BreakerStatus getStatus(BreakerId breakerId);

    /**
     * 전체 상태 조회.
     *
     * @return breakerId 순 상태 목록
     */
    List<BreakerStatus> getAllStatuses();

    /**
     * 전체 요약.
     *
     * @return StatusSummary
     */
    StatusSummary summarize();
}
