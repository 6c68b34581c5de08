package com.ryuqq.isolation.adapter.runner;

import java.time.Duration;

/**
 * 적응형 임계값 재보정 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param interval 재보정 주기 (양수여야 함, 기본 30초)
 */
public record RecalibrationConfig(
    Duration interval
) {

    /**
     * 기본 설정 생성자 (interval=30s).
     */
    public RecalibrationConfig() {
        this(Duration.ofSeconds(30));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RecalibrationConfig {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
    }

    /**
     * interval만 변경한 새 인스턴스 생성.
     */
    public RecalibrationConfig withInterval(Duration interval) {
        return new RecalibrationConfig(interval);
    }
}
