package com.ryuqq.isolation.application.coordination;

import com.ryuqq.isolation.core.coordination.CoordinatedResponse;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.SystemLayer;

import java.util.Set;

/**
 * 여러 계층에 걸친 조정 격리.
 *
 * <p><strong>동작:</strong></p>
 * <pre>
 * 1. affectedLayers에 속한 등록된 breaker를 모두 찾음 (새 breaker는 만들지 않음)
 * 2. 각각 OPEN으로 전이 (breaker별 timeout, 최선 노력)
 *    - 이미 OPEN: 영향받은 것으로 집계
 *    - FORCE_OPEN / EMERGENCY / timeout: unaffected로 기록, 전체는 계속
 * 3. breaker당 한 단계의 연속성 계획 작성
 * 4. 예상 복구 시각 = now + max(openDuration)
 * 5. 그 시각에 복구 점검 예약 (트리거 breaker가 먼저 회복하면 취소 가능)
 * </pre>
 *
 * <p>여러 breaker에 걸친 트랜잭션은 없습니다. 결과는 최종적 일관성입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CoordinationOrchestrator {

    /**
     * 조정 격리 실행.
     *
     * @param triggerBreakerId 조정을 요청한 breaker
     * @param affectedLayers 격리할 계층
     * @return 조정 결과 (부분 실패 포함)
     * @throws com.ryuqq.isolation.core.spi.BreakerNotFoundException 트리거 breaker가 등록되지 않은 경우
     * @throws IllegalArgumentException affectedLayers가 null인 경우
     */
    CoordinatedResponse coordinate(BreakerId triggerBreakerId, Set<SystemLayer> affectedLayers);

    /**
     * 트리거 breaker가 예약한 복구 점검 취소.
     *
     * @param triggerBreakerId 트리거 breaker
     * @return 취소한 점검 수
     */
    int cancelRecoveryMonitors(BreakerId triggerBreakerId);
}
