package com.ryuqq.isolation.core.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 고정 크기 버킷 배열 기반의 롤링 결과 창.
 *
 * <p>timeWindow를 bucketCount개의 버킷으로 나누고, 버킷 배열을 원형으로 재사용합니다.
 * 창 밖으로 밀려난 버킷은 다음 기록 시 새 시작 시각으로 초기화되므로
 * 메모리 사용량은 버킷 수에 고정됩니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 동기화하지 않습니다.
 * 소유자인 {@link BreakerMetrics}와 마찬가지로 breaker 락 안에서만 접근해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RollingOutcomeWindow {

    private final long bucketMillis;
    private final long intervalMillis;
    private final Bucket[] buckets;

    /**
     * 생성자.
     *
     * @param timeWindow 창 길이
     * @param bucketCount 버킷 수
     * @throws IllegalArgumentException 창 길이가 버킷 수(ms)보다 작거나 버킷 수가 1 미만인 경우
     */
    public RollingOutcomeWindow(Duration timeWindow, int bucketCount) {
        if (timeWindow == null) {
            throw new IllegalArgumentException("timeWindow cannot be null");
        }
        if (bucketCount < 1) {
            throw new IllegalArgumentException("bucketCount must be positive (current: " + bucketCount + ")");
        }
        long windowMillis = timeWindow.toMillis();
        if (windowMillis < bucketCount) {
            throw new IllegalArgumentException(
                "timeWindow must be at least " + bucketCount + "ms (current: " + timeWindow + ")"
            );
        }
        this.bucketMillis = windowMillis / bucketCount;
        this.intervalMillis = bucketMillis * bucketCount;
        this.buckets = new Bucket[bucketCount];
    }

    /**
     * 결과 기록.
     *
     * @param at 발생 시각
     * @param failure 실패 여부
     */
    public void record(Instant at, boolean failure) {
        Bucket bucket = bucketAt(at.toEpochMilli());
        if (failure) {
            bucket.failures++;
        } else {
            bucket.successes++;
        }
    }

    /**
     * 창 안의 실패 수.
     *
     * @param now 기준 시각
     * @return 실패 수
     */
    public long failures(Instant now) {
        long sum = 0;
        for (Bucket bucket : validBuckets(now.toEpochMilli())) {
            sum += bucket.failures;
        }
        return sum;
    }

    /**
     * 창 안의 전체 결과 수.
     *
     * @param now 기준 시각
     * @return 전체 수
     */
    public long total(Instant now) {
        long sum = 0;
        for (Bucket bucket : validBuckets(now.toEpochMilli())) {
            sum += bucket.failures + bucket.successes;
        }
        return sum;
    }

    /**
     * 창 안의 비어 있지 않은 버킷별 실패율 (오래된 순).
     *
     * @param now 기준 시각
     * @return 버킷별 실패율
     */
    public List<Double> bucketFailureRates(Instant now) {
        List<Bucket> valid = validBuckets(now.toEpochMilli());
        valid.sort(Comparator.comparingLong(bucket -> bucket.start));
        List<Double> rates = new ArrayList<>(valid.size());
        for (Bucket bucket : valid) {
            long total = bucket.failures + bucket.successes;
            if (total > 0) {
                rates.add((double) bucket.failures / total);
            }
        }
        return List.copyOf(rates);
    }

    /**
     * 모든 버킷 초기화.
     */
    public void reset() {
        for (int i = 0; i < buckets.length; i++) {
            buckets[i] = null;
        }
    }

    private Bucket bucketAt(long timeMillis) {
        int idx = (int) ((timeMillis / bucketMillis) % buckets.length);
        long start = timeMillis - timeMillis % bucketMillis;
        Bucket bucket = buckets[idx];
        if (bucket == null) {
            bucket = new Bucket(start);
            buckets[idx] = bucket;
        } else if (bucket.start < start) {
            bucket.resetTo(start);
        }
        // bucket.start > start: 시계가 뒤로 간 경우, 기존 버킷에 그대로 누적
        return bucket;
    }

    private List<Bucket> validBuckets(long nowMillis) {
        List<Bucket> valid = new ArrayList<>(buckets.length);
        for (Bucket bucket : buckets) {
            if (bucket != null && nowMillis - bucket.start < intervalMillis) {
                valid.add(bucket);
            }
        }
        return valid;
    }

    private static final class Bucket {
        private long start;
        private long failures;
        private long successes;

        private Bucket(long start) {
            this.start = start;
        }

        private void resetTo(long start) {
            this.start = start;
            this.failures = 0;
            this.successes = 0;
        }
    }
}
