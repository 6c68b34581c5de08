package com.ryuqq.isolation.core.adaptive;

import com.ryuqq.isolation.core.config.AdaptivePolicy;
import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

import java.util.List;

/**
 * 적응형 임계값 계산기.
 *
 * <p>롤링 창의 버킷별 실패율을 오래된 순으로 지수 평활한 뒤,
 * 평활값 위에 headroom을 더해 [minThreshold, maxThreshold]로 제한합니다.</p>
 *
 * <pre>
 * 표본 있음: effective = clamp(ewma(bucketRates, α) + headroom)
 * 표본 없음: effective = clamp(baseline)
 * </pre>
 *
 * <p>스냅샷의 순수 함수이므로 새 결과가 없는 동안 반복 호출해도 같은 값을 냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AdaptiveThresholdCalculator {

    /**
     * 유효 임계값 계산.
     *
     * @param config breaker 설정
     * @param snapshot 지표 스냅샷
     * @return 계산 결과
     * @throws IllegalArgumentException config 또는 snapshot이 null인 경우
     */
    public AdaptiveThreshold calculate(BreakerConfig config, MetricsSnapshot snapshot) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        AdaptivePolicy policy = config.adaptive();
        double baseline = config.baselineThreshold();
        List<Double> rates = snapshot.bucketFailureRates();

        if (rates.isEmpty()) {
            return new AdaptiveThreshold(policy.clamp(baseline), 0.0, baseline, 0);
        }

        double smoothed = ExponentialSmoothing.fold(rates, policy.smoothingFactor());
        double effective = policy.clamp(smoothed + policy.headroom());
        return new AdaptiveThreshold(effective, smoothed, baseline, rates.size());
    }
}
