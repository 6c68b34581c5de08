package com.ryuqq.isolation.core.detector;

/**
 * 감지 판정 결과 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param open breaker를 열어야 하면 true
 * @param reason 사람이 읽는 사유
 * @param evidence 전략별 판정 근거
 */
public record DetectionResult(
    boolean open,
    String reason,
    DetectionEvidence evidence
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException reason 또는 evidence가 null인 경우
     */
    public DetectionResult {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (evidence == null) {
            throw new IllegalArgumentException("evidence cannot be null");
        }
    }

    /**
     * 열기 판정.
     *
     * @param reason 사유
     * @param evidence 근거
     * @return open=true 결과
     */
    public static DetectionResult trip(String reason, DetectionEvidence evidence) {
        return new DetectionResult(true, reason, evidence);
    }

    /**
     * 유지 판정.
     *
     * @param reason 사유
     * @param evidence 근거
     * @return open=false 결과
     */
    public static DetectionResult hold(String reason, DetectionEvidence evidence) {
        return new DetectionResult(false, reason, evidence);
    }
}
