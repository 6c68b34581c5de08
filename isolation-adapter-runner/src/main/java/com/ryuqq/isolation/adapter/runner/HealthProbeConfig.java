package com.ryuqq.isolation.adapter.runner;

import java.time.Duration;

/**
 * 헬스 체크 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param interval 스캔 주기 (양수여야 함, 기본 10초)
 * @param initialDelay 첫 스캔까지의 지연 (음수 불가, 기본 10초)
 */
public record HealthProbeConfig(
    Duration interval,
    Duration initialDelay
) {

    /**
     * 기본 설정 생성자 (interval=10s, initialDelay=10s).
     */
    public HealthProbeConfig() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(10));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public HealthProbeConfig {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative (current: " + initialDelay + ")");
        }
    }

    /**
     * interval만 변경한 새 인스턴스 생성.
     */
    public HealthProbeConfig withInterval(Duration interval) {
        return new HealthProbeConfig(interval, initialDelay);
    }

    /**
     * initialDelay만 변경한 새 인스턴스 생성.
     */
    public HealthProbeConfig withInitialDelay(Duration initialDelay) {
        return new HealthProbeConfig(interval, initialDelay);
    }
}
