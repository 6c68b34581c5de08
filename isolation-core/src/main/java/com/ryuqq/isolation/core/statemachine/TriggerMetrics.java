package com.ryuqq.isolation.core.statemachine;

/**
 * 전이 시점의 지표 스냅샷 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param failureCount 실패 수
 * @param successCount 성공 수
 * @param totalCount 전체 수
 * @param failureRate 실패율
 * @param consecutiveSuccesses 연속 성공 수
 */
public record TriggerMetrics(
    long failureCount,
    long successCount,
    long totalCount,
    double failureRate,
    long consecutiveSuccesses
) {

    /**
     * 전부 0인 스냅샷.
     *
     * @return 빈 TriggerMetrics
     */
    public static TriggerMetrics empty() {
        return new TriggerMetrics(0, 0, 0, 0.0, 0);
    }
}
