package com.ryuqq.isolation.core.config;

import java.time.Duration;

/**
 * 상태 유지 시간 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>openDuration: OPEN 유지 시간, 경과 후 HALF_OPEN 재평가 (기본 30초)</li>
 *   <li>halfOpenMaxProbes: HALF_OPEN 창에서 허용할 probe 요청 수 (기본 3)</li>
 *   <li>emergencyDuration: EMERGENCY 에스컬레이션 검토 기한 (기본 5분)</li>
 * </ul>
 *
 * <p>emergencyDuration이 지나도 EMERGENCY는 자동 해제되지 않습니다.
 * 상태 조회에서 검토 기한 초과로 표시될 뿐입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param openDuration OPEN 유지 시간
 * @param halfOpenMaxProbes HALF_OPEN probe 허용 수
 * @param emergencyDuration EMERGENCY 검토 기한
 */
public record TimingPolicy(
    Duration openDuration,
    int halfOpenMaxProbes,
    Duration emergencyDuration
) {

    /**
     * 기본 설정 생성자.
     */
    public TimingPolicy() {
        this(Duration.ofSeconds(30), 3, Duration.ofMinutes(5));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws InvalidBreakerConfigException 파라미터 검증 실패 시
     */
    public TimingPolicy {
        ConfigChecks.requirePositive(openDuration, "openDuration");
        ConfigChecks.requireAtLeast(halfOpenMaxProbes, 1, "halfOpenMaxProbes");
        ConfigChecks.requirePositive(emergencyDuration, "emergencyDuration");
    }

    public TimingPolicy withOpenDuration(Duration openDuration) {
        return new TimingPolicy(openDuration, halfOpenMaxProbes, emergencyDuration);
    }

    public TimingPolicy withHalfOpenMaxProbes(int halfOpenMaxProbes) {
        return new TimingPolicy(openDuration, halfOpenMaxProbes, emergencyDuration);
    }

    public TimingPolicy withEmergencyDuration(Duration emergencyDuration) {
        return new TimingPolicy(openDuration, halfOpenMaxProbes, emergencyDuration);
    }
}
