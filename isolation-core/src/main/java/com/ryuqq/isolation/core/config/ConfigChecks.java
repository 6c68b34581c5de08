package com.ryuqq.isolation.core.config;

import java.time.Duration;

/**
 * 설정 record 공통 검증.
 */
final class ConfigChecks {

    private ConfigChecks() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new InvalidBreakerConfigException(name + " cannot be null");
        }
        return value;
    }

    static Duration requirePositive(Duration value, String name) {
        requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new InvalidBreakerConfigException(
                name + " must be positive (current: " + value + ")"
            );
        }
        return value;
    }

    static void requireAtLeast(long value, long min, String name) {
        if (value < min) {
            throw new InvalidBreakerConfigException(
                name + " must be at least " + min + " (current: " + value + ")"
            );
        }
    }

    static void requireRatio(double value, boolean allowZero, String name) {
        boolean lowerOk = allowZero ? value >= 0.0 : value > 0.0;
        if (Double.isNaN(value) || !lowerOk || value > 1.0) {
            throw new InvalidBreakerConfigException(
                name + " must be in " + (allowZero ? "[0, 1]" : "(0, 1]") + " (current: " + value + ")"
            );
        }
    }
}
