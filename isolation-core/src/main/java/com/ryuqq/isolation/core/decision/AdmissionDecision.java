package com.ryuqq.isolation.core.decision;

import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.model.BusinessImpactTier;

import java.time.Instant;
import java.util.Optional;

/**
 * 요청 하나에 대한 허용/거부 결정 (불변 record).
 *
 * <p><strong>confidence 값:</strong></p>
 * <ul>
 *   <li>CLOSED 허용: 0.95</li>
 *   <li>OPEN 비즈니스 예외 허용: 0.8</li>
 *   <li>HALF_OPEN probe 허용: 0.7</li>
 *   <li>OPEN / HALF_OPEN 거부: 0.9</li>
 *   <li>FORCE_OPEN / EMERGENCY 거부: 1.0</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param allowed 허용 여부
 * @param state 결정 시점 상태
 * @param reason 사유 코드
 * @param message 사람이 읽는 사유
 * @param estimatedRecoveryAt 예상 복구 시각 (OPEN 거부일 때만)
 * @param fallbackHint 대체 경로 권장 (없으면 empty)
 * @param confidence 결정 신뢰도 [0, 1]
 * @param failureRate 결정에 사용한 실패율
 * @param threshold 결정에 사용한 임계값
 * @param escalationRequired 외부 에스컬레이션 필요 여부
 * @param impactTier 이 결정의 영향 등급
 */
public record AdmissionDecision(
    boolean allowed,
    BreakerState state,
    DecisionReason reason,
    String message,
    Optional<Instant> estimatedRecoveryAt,
    Optional<FallbackHint> fallbackHint,
    double confidence,
    double failureRate,
    double threshold,
    boolean escalationRequired,
    BusinessImpactTier impactTier
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 confidence가 범위를 벗어난 경우
     */
    public AdmissionDecision {
        if (state == null || reason == null || impactTier == null) {
            throw new IllegalArgumentException("state, reason and impactTier cannot be null");
        }
        if (estimatedRecoveryAt == null || fallbackHint == null) {
            throw new IllegalArgumentException("optional fields cannot be null, use Optional.empty()");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1] (current: " + confidence + ")");
        }
        if (message == null) {
            message = "";
        }
    }
}
