package com.ryuqq.isolation.core.model;

/**
 * 실패 결과의 비즈니스 영향 정보 (불변 record).
 *
 * <p>영향 등급과 위험 금액은 외부 분류기가 산정한 값을 그대로 받습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param tier 실패의 영향 등급 (nullable: 미분류, 비상 에스컬레이션 대상 아님)
 * @param valueAtRisk 위험 금액 추정치 (0 이상)
 * @param customerFacing 고객 노출 실패 여부
 * @param revenueImpacting 매출 영향 실패 여부
 * @param errorCode 오류 코드 (nullable)
 */
public record ErrorContext(
    BusinessImpactTier tier,
    double valueAtRisk,
    boolean customerFacing,
    boolean revenueImpacting,
    String errorCode
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException valueAtRisk가 음수이거나 유한하지 않은 경우
     */
    public ErrorContext {
        if (valueAtRisk < 0 || !Double.isFinite(valueAtRisk)) {
            throw new IllegalArgumentException(
                "valueAtRisk must be a non-negative finite number (current: " + valueAtRisk + ")"
            );
        }
    }

    /**
     * 분류 정보 없는 실패.
     *
     * @return 미분류 ErrorContext
     */
    public static ErrorContext unclassified() {
        return new ErrorContext(null, 0.0, false, false, null);
    }

    /**
     * 등급만 지정한 실패.
     *
     * @param tier 영향 등급
     * @return ErrorContext
     */
    public static ErrorContext of(BusinessImpactTier tier) {
        return new ErrorContext(tier, 0.0, false, false, null);
    }

    /**
     * 등급과 위험 금액을 지정한 매출 영향 실패.
     *
     * @param tier 영향 등급
     * @param valueAtRisk 위험 금액
     * @return ErrorContext
     */
    public static ErrorContext revenueImpacting(BusinessImpactTier tier, double valueAtRisk) {
        return new ErrorContext(tier, valueAtRisk, true, true, null);
    }
}
