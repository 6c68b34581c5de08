package com.ryuqq.isolation.core.config;

import com.ryuqq.isolation.core.model.DetectionStrategy;

import java.time.Duration;

/**
 * 장애 감지 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>strategy: 감지 알고리즘 (기본 SIMPLE_THRESHOLD)</li>
 *   <li>failureThreshold: 실패율 임계값, (0, 1] (기본 0.5)</li>
 *   <li>minimumSamples: 판정에 필요한 최소 표본 수 (기본 10)</li>
 *   <li>timeWindow: 롤링 창 길이 (기본 60초)</li>
 *   <li>windowBuckets: 롤링 창 버킷 수 (기본 6)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param strategy 감지 알고리즘
 * @param failureThreshold 실패율 임계값
 * @param minimumSamples 최소 표본 수
 * @param timeWindow 롤링 창 길이
 * @param windowBuckets 롤링 창 버킷 수
 */
public record DetectionPolicy(
    DetectionStrategy strategy,
    double failureThreshold,
    int minimumSamples,
    Duration timeWindow,
    int windowBuckets
) {

    /**
     * 기본 설정 생성자.
     */
    public DetectionPolicy() {
        this(DetectionStrategy.SIMPLE_THRESHOLD, 0.5, 10, Duration.ofSeconds(60), 6);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws InvalidBreakerConfigException 파라미터 검증 실패 시
     */
    public DetectionPolicy {
        ConfigChecks.requireNonNull(strategy, "strategy");
        ConfigChecks.requireRatio(failureThreshold, false, "failureThreshold");
        ConfigChecks.requireAtLeast(minimumSamples, 1, "minimumSamples");
        ConfigChecks.requirePositive(timeWindow, "timeWindow");
        ConfigChecks.requireAtLeast(windowBuckets, 1, "windowBuckets");
        if (timeWindow.toMillis() < windowBuckets) {
            throw new InvalidBreakerConfigException(
                "timeWindow must be at least one millisecond per bucket (timeWindow: "
                    + timeWindow + ", windowBuckets: " + windowBuckets + ")"
            );
        }
    }

    public DetectionPolicy withStrategy(DetectionStrategy strategy) {
        return new DetectionPolicy(strategy, failureThreshold, minimumSamples, timeWindow, windowBuckets);
    }

    public DetectionPolicy withFailureThreshold(double failureThreshold) {
        return new DetectionPolicy(strategy, failureThreshold, minimumSamples, timeWindow, windowBuckets);
    }

    public DetectionPolicy withMinimumSamples(int minimumSamples) {
        return new DetectionPolicy(strategy, failureThreshold, minimumSamples, timeWindow, windowBuckets);
    }

    public DetectionPolicy withTimeWindow(Duration timeWindow, int windowBuckets) {
        return new DetectionPolicy(strategy, failureThreshold, minimumSamples, timeWindow, windowBuckets);
    }
}
