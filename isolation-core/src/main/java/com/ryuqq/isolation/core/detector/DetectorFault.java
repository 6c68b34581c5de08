package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.model.DetectionStrategy;

/**
 * 감지기 오류 근거.
 *
 * <p>감지기가 예외를 던지면 판정은 열기(fail safe toward denial)로 처리되고
 * 이 근거가 붙습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param strategy 오류가 난 전략
 * @param errorType 예외 클래스 이름
 * @param message 예외 메시지
 */
public record DetectorFault(
    DetectionStrategy strategy,
    String errorType,
    String message
) implements DetectionEvidence {
}
