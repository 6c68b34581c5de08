package com.ryuqq.isolation.core.metrics;

import com.ryuqq.isolation.core.model.BusinessImpactTier;

import java.util.Optional;

/**
 * 누적 비즈니스 영향 집계 (불변 record).
 *
 * <p>운영자 초기화(reset) 전까지 상태 전이와 무관하게 누적됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param valueAtRisk 누적 위험 금액
 * @param revenueImpactingFailures 매출 영향 실패 수
 * @param customerFacingFailures 고객 노출 실패 수
 * @param worstTier 관측된 최고 등급 (분류된 실패가 없으면 empty)
 */
public record ImpactTotals(
    double valueAtRisk,
    long revenueImpactingFailures,
    long customerFacingFailures,
    Optional<BusinessImpactTier> worstTier
) {

    /**
     * 빈 집계.
     *
     * @return 전부 0인 ImpactTotals
     */
    public static ImpactTotals none() {
        return new ImpactTotals(0.0, 0, 0, Optional.empty());
    }
}
