package com.ryuqq.isolation.core.metrics;

import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.statemachine.StateTransition;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * {@link BreakerMetrics}의 특정 시점 불변 스냅샷.
 *
 * <p>감지기와 적응형 임계값 계산은 이 스냅샷만 읽으므로 순수 함수로 유지됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param state 현재 상태
 * @param failureCount 현재 평가 창의 실패 수
 * @param successCount 현재 평가 창의 성공 수
 * @param consecutiveSuccesses 연속 성공 수
 * @param probesIssued 현재 HALF_OPEN 창에서 허용한 probe 수
 * @param windowFailures 롤링 창 안의 실패 수
 * @param windowTotal 롤링 창 안의 전체 수
 * @param bucketFailureRates 롤링 창 버킷별 실패율 (오래된 순)
 * @param averageLatency 성공 요청 평균 지연
 * @param lastFailureAt 마지막 실패 시각
 * @param lastSuccessAt 마지막 성공 시각
 * @param stateEnteredAt 현재 상태 진입 시각
 * @param earliestReevaluationAt OPEN일 때 재평가 가능 시각
 * @param escalationReviewDueAt EMERGENCY일 때 검토 기한
 * @param effectiveThreshold 재보정된 유효 임계값 (미계산이면 empty)
 * @param smoothedFailureRate 재보정 시 계산한 평활 실패율 (미계산이면 empty)
 * @param impact 비즈니스 영향 집계
 * @param history 전이 이력 (오래된 순)
 * @param capturedAt 스냅샷 시각
 */
public record MetricsSnapshot(
    BreakerState state,
    long failureCount,
    long successCount,
    long consecutiveSuccesses,
    int probesIssued,
    long windowFailures,
    long windowTotal,
    List<Double> bucketFailureRates,
    Duration averageLatency,
    Optional<Instant> lastFailureAt,
    Optional<Instant> lastSuccessAt,
    Instant stateEnteredAt,
    Optional<Instant> earliestReevaluationAt,
    Optional<Instant> escalationReviewDueAt,
    OptionalDouble effectiveThreshold,
    OptionalDouble smoothedFailureRate,
    ImpactTotals impact,
    List<StateTransition> history,
    Instant capturedAt
) {

    /**
     * Compact constructor (방어적 복사).
     */
    public MetricsSnapshot {
        bucketFailureRates = List.copyOf(bucketFailureRates);
        history = List.copyOf(history);
    }

    /**
     * 현재 평가 창의 전체 수.
     *
     * @return failureCount + successCount
     */
    public long totalCount() {
        return failureCount + successCount;
    }

    /**
     * 현재 평가 창의 실패율.
     *
     * @return 실패율 (표본이 없으면 0)
     */
    public double failureRate() {
        long total = totalCount();
        return total == 0 ? 0.0 : (double) failureCount / total;
    }

    /**
     * 롤링 창의 실패율.
     *
     * @return 실패율 (표본이 없으면 0)
     */
    public double windowFailureRate() {
        return windowTotal == 0 ? 0.0 : (double) windowFailures / windowTotal;
    }
}
