package com.ryuqq.isolation.application.outcome;

import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.ErrorContext;

import java.time.Duration;

/**
 * 요청 결과 보고 진입점.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>CLOSED 실패: 감지기 평가, 열기 판정이면 OPEN</li>
 *   <li>HALF_OPEN 성공: 연속 성공이 successThreshold에 도달하면 CLOSED (카운터 전체 초기화)</li>
 *   <li>HALF_OPEN 실패: 즉시 OPEN, openDuration 재시작</li>
 *   <li>emergencyTier 이상 실패 + 비상 에스컬레이션 사용: 즉시 EMERGENCY</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OutcomeRecorder {

    /**
     * 성공 기록.
     *
     * @param breakerId breaker id
     * @param latency 요청 지연 (nullable)
     * @throws com.ryuqq.isolation.core.spi.BreakerNotFoundException 등록되지 않은 id인 경우
     */
    void recordSuccess(BreakerId breakerId, Duration latency);

    /**
     * 실패 기록. 위험 금액을 누적합니다.
     *
     * @param breakerId breaker id
     * @param errorContext 실패 컨텍스트 (null이면 미분류)
     * @throws com.ryuqq.isolation.core.spi.BreakerNotFoundException 등록되지 않은 id인 경우
     */
    void recordFailure(BreakerId breakerId, ErrorContext errorContext);
}
