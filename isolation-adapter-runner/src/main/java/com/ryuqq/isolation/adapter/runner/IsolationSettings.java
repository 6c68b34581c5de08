package com.ryuqq.isolation.adapter.runner;

/**
 * 서비스 전역 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>businessOverrideEnabled: OPEN breaker에서 매출 영향 요청 우회 허용 여부 (기본 true).
 *       breaker별 businessAwareBreaking도 켜져 있어야 적용됩니다.</li>
 *   <li>coordinateOnTrip: 임계값 초과로 OPEN될 때 계층 간 격리 자동 실행 여부 (기본 true)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param businessOverrideEnabled 비즈니스 우회 허용 여부
 * @param coordinateOnTrip trip 시 자동 조정 여부
 */
public record IsolationSettings(
    boolean businessOverrideEnabled,
    boolean coordinateOnTrip
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: businessOverrideEnabled=true, coordinateOnTrip=true</p>
     */
    public IsolationSettings() {
        this(true, true);
    }

    /**
     * businessOverrideEnabled만 변경한 새 인스턴스 생성.
     */
    public IsolationSettings withBusinessOverrideEnabled(boolean businessOverrideEnabled) {
        return new IsolationSettings(businessOverrideEnabled, coordinateOnTrip);
    }

    /**
     * coordinateOnTrip만 변경한 새 인스턴스 생성.
     */
    public IsolationSettings withCoordinateOnTrip(boolean coordinateOnTrip) {
        return new IsolationSettings(businessOverrideEnabled, coordinateOnTrip);
    }
}
