package com.ryuqq.isolation.testkit.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트에서 직접 진행시키는 {@link Clock}.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
 * clock.advance(Duration.ofSeconds(30));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final ZoneId zone;
    private volatile Instant instant;

    /**
     * 생성자.
     *
     * @param instant 시작 시각
     * @param zone 시간대
     */
    public MutableClock(Instant instant, ZoneId zone) {
        if (instant == null || zone == null) {
            throw new IllegalArgumentException("instant and zone cannot be null");
        }
        this.instant = instant;
        this.zone = zone;
    }

    /**
     * UTC 시계 생성.
     *
     * @param isoInstant ISO-8601 시각 문자열
     * @return MutableClock
     */
    public static MutableClock startingAt(String isoInstant) {
        return new MutableClock(Instant.parse(isoInstant), ZoneOffset.UTC);
    }

    /**
     * 시간 진행.
     *
     * @param duration 진행할 시간 (음수면 시계를 되돌림)
     */
    public synchronized void advance(Duration duration) {
        instant = instant.plus(duration);
    }

    /**
     * 시각 지정.
     *
     * @param instant 새 시각
     */
    public void setInstant(Instant instant) {
        this.instant = instant;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
