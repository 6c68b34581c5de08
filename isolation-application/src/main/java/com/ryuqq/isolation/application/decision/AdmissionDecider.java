package com.ryuqq.isolation.application.decision;

import com.ryuqq.isolation.core.decision.AdmissionDecision;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.RequestContext;

/**
 * 요청 단위 진입점: 요청을 보호 대상으로 보낼지 결정합니다.
 *
 * <p><strong>상태별 동작:</strong></p>
 * <ul>
 *   <li>CLOSED: 감지기를 재평가한 뒤 허용 (실패율과 임계값을 진단값으로 첨부)</li>
 *   <li>OPEN: 거부하고 예상 복구 시각 반환. 비즈니스 인지 예외 조건이면 낮은 신뢰도로 허용</li>
 *   <li>HALF_OPEN: probe 할당량까지 허용, 소진 후 거부</li>
 *   <li>FORCE_OPEN: 항상 거부, 예상 복구 시각 없음</li>
 *   <li>EMERGENCY: 항상 거부, 외부 에스컬레이션 필요 표시</li>
 * </ul>
 *
 * <p><strong>부수 효과:</strong> 실패/성공 카운터는 바꾸지 않습니다.
 * 허용되는 상태 변경은 시간/임계값 기반 정리(CLOSED → OPEN, OPEN → HALF_OPEN)와
 * HALF_OPEN probe 수 증가뿐입니다.</p>
 *
 * <p><strong>지연:</strong> 블로킹 I/O 없이 메모리 상태만으로 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AdmissionDecider {

    /**
     * 요청 허용 여부 결정.
     *
     * @param breakerId breaker id
     * @param context 요청 비즈니스 컨텍스트 (null이면 {@link RequestContext#none()})
     * @return 결정
     * @throws com.ryuqq.isolation.core.spi.BreakerNotFoundException 등록되지 않은 id인 경우
     */
    AdmissionDecision shouldAllowRequest(BreakerId breakerId, RequestContext context);

    /**
     * 컨텍스트 없이 요청 허용 여부 결정.
     *
     * @param breakerId breaker id
     * @return 결정
     * @throws com.ryuqq.isolation.core.spi.BreakerNotFoundException 등록되지 않은 id인 경우
     */
    default AdmissionDecision shouldAllowRequest(BreakerId breakerId) {
        return shouldAllowRequest(breakerId, RequestContext.none());
    }
}
