package com.ryuqq.isolation.core.model;

/**
 * 요청의 비즈니스 컨텍스트 (불변 record).
 *
 * <p>호출자가 알 수 없는 경우 {@link #none()}을 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param tier 요청의 영향 등급 (nullable: 미분류)
 * @param customerFacing 고객 노출 요청 여부
 * @param revenueImpacting 매출 영향 요청 여부
 */
public record RequestContext(
    BusinessImpactTier tier,
    boolean customerFacing,
    boolean revenueImpacting
) {

    private static final RequestContext NONE = new RequestContext(null, false, false);

    /**
     * 비즈니스 정보가 없는 컨텍스트.
     *
     * @return 빈 컨텍스트
     */
    public static RequestContext none() {
        return NONE;
    }

    /**
     * 매출 영향 요청 컨텍스트.
     *
     * @param tier 영향 등급
     * @return 고객 노출 + 매출 영향 컨텍스트
     */
    public static RequestContext revenueImpacting(BusinessImpactTier tier) {
        return new RequestContext(tier, true, true);
    }

    /**
     * 등급이 없으면 fallback을 반환.
     *
     * @param fallback 대체 등급
     * @return tier 또는 fallback
     */
    public BusinessImpactTier tierOr(BusinessImpactTier fallback) {
        return tier != null ? tier : fallback;
    }
}
