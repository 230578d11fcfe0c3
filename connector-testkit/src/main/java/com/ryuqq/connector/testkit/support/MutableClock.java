package com.ryuqq.connector.testkit.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 테스트에서 시간을 직접 제어할 수 있는 Clock.
 *
 * <p>TTL 만료, Circuit Breaker timeout, 토큰 만료 등 시간 의존 동작을
 * sleep 없이 검증하기 위해 사용합니다. 스레드 안전합니다.</p>
 *
 * <pre>{@code
 * MutableClock clock = MutableClock.startingAt(Instant.parse("2024-01-01T00:00:00Z"));
 * clock.advance(Duration.ofSeconds(31));
 * }</pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    private MutableClock(AtomicReference<Instant> now, ZoneId zone) {
        this.now = now;
        this.zone = zone;
    }

    public static MutableClock startingAt(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        return new MutableClock(new AtomicReference<>(instant), ZoneOffset.UTC);
    }

    public static MutableClock startingNow() {
        return startingAt(Instant.now());
    }

    /**
     * 현재 시각을 앞으로 이동.
     *
     * @param duration 이동할 시간 (음수 불가)
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative (current: " + duration + ")");
        }
        now.updateAndGet(current -> current.plus(duration));
    }

    public void setInstant(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now.get();
    }
}
