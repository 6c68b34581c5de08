package com.ryuqq.isolation.application.facade;

import com.ryuqq.isolation.application.decision.AdmissionDecider;
import com.ryuqq.isolation.application.operator.BreakerAdministration;
import com.ryuqq.isolation.application.outcome.OutcomeRecorder;

/**
 * 장애 격리 서비스 전체 진입점.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AdmissionDecision decision = isolation.shouldAllowRequest(breakerId, context);
 * if (!decision.allowed()) {
 *     return fallback(decision.fallbackHint());
 * }
 * try {
 *     Response response = call();
 *     isolation.recordSuccess(breakerId, elapsed);
 *     return response;
 * } catch (Exception e) {
 *     isolation.recordFailure(breakerId, classify(e));
 *     throw e;
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FailureIsolation extends AdmissionDecider, OutcomeRecorder, BreakerAdministration {

    /**
     * 영속 저장소에서 breaker를 복원.
     *
     * <p>영속 저장소를 사용할 수 없으면 로그를 남기고 0을 반환합니다.</p>
     *
     * @return 복원한 breaker 수
     */
    int restore();
}
