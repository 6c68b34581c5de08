package com.ryuqq.isolation.core.coordination;

import com.ryuqq.isolation.core.model.BreakerId;

import java.time.Instant;
import java.util.List;

/**
 * 조정 격리 결과 (불변 record).
 *
 * <p>일부 breaker가 전이하지 못해도 예외를 던지지 않고 {@link #unaffected()}에 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param coordinationId 조정 식별자
 * @param triggerBreakerId 조정을 요청한 breaker
 * @param affectedBreakers OPEN이 된(또는 이미 OPEN이던) breaker
 * @param unaffected 전이하지 못한 breaker와 사유
 * @param strategy 실행 방식
 * @param continuityPlan 단계 목록 (affectedBreakers와 같은 순서)
 * @param fallbackEndpoints 대상 breaker들의 헬스 체크 엔드포인트
 * @param startedAt 조정 시작 시각
 * @param estimatedRecoveryAt 예상 복구 시각 (대상 openDuration의 최댓값 기준)
 */
public record CoordinatedResponse(
    String coordinationId,
    BreakerId triggerBreakerId,
    List<BreakerId> affectedBreakers,
    List<CoordinationFailure> unaffected,
    CoordinationStrategy strategy,
    List<ContinuityStep> continuityPlan,
    List<String> fallbackEndpoints,
    Instant startedAt,
    Instant estimatedRecoveryAt
) {

    /**
     * Compact constructor (방어적 복사).
     */
    public CoordinatedResponse {
        affectedBreakers = List.copyOf(affectedBreakers);
        unaffected = List.copyOf(unaffected);
        continuityPlan = List.copyOf(continuityPlan);
        fallbackEndpoints = List.copyOf(fallbackEndpoints);
    }

    /**
     * 일부 breaker가 전이하지 못했는지 확인.
     *
     * @return unaffected가 비어 있지 않으면 true
     */
    public boolean isPartial() {
        return !unaffected.isEmpty();
    }
}
