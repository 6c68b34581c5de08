package com.ryuqq.isolation.testkit.fixture;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.config.DetectionPolicy;
import com.ryuqq.isolation.core.config.RecoveryPolicy;
import com.ryuqq.isolation.core.config.TimingPolicy;
import com.ryuqq.isolation.core.model.BusinessImpactTier;
import com.ryuqq.isolation.core.model.DetectionStrategy;
import com.ryuqq.isolation.core.model.SystemLayer;

import java.time.Duration;

/**
 * 테스트용 BreakerConfig 생성 헬퍼.
 *
 * <p>기본값: threshold=0.5, minimumSamples=10, openDuration=30s,
 * successThreshold=3, halfOpenMaxProbes=3, timeWindow=60s/6 buckets.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BreakerFixtures {

    /** 기본 OPEN 유지 시간 */
    public static final Duration OPEN_DURATION = Duration.ofSeconds(30);

    private BreakerFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 정책 빌더.
     *
     * @param breakerId 식별자
     * @param layer 계층
     * @return Builder
     */
    public static BreakerConfig.Builder builder(String breakerId, SystemLayer layer) {
        return BreakerConfig.builder(breakerId)
            .name(breakerId + " breaker")
            .systemLayer(layer)
            .businessImpactTier(BusinessImpactTier.MEDIUM)
            .detection(new DetectionPolicy(DetectionStrategy.SIMPLE_THRESHOLD, 0.5, 10, Duration.ofSeconds(60), 6))
            .timing(new TimingPolicy(OPEN_DURATION, 3, Duration.ofMinutes(5)))
            .recovery(new RecoveryPolicy(3, 3, 2.0, null));
    }

    /**
     * API 계층 기본 설정.
     *
     * @param breakerId 식별자
     * @return BreakerConfig
     */
    public static BreakerConfig standard(String breakerId) {
        return builder(breakerId, SystemLayer.API).build();
    }

    /**
     * 지정 계층 기본 설정.
     *
     * @param breakerId 식별자
     * @param layer 계층
     * @return BreakerConfig
     */
    public static BreakerConfig atLayer(String breakerId, SystemLayer layer) {
        return builder(breakerId, layer).build();
    }
}
