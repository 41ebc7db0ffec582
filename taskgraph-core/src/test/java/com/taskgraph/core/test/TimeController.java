package com.taskgraph.core.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock for testing time-dependent behavior.
 * Lets tests move time forward without actually waiting.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TimeController time = TimeController.frozenAt(Instant.parse("2024-01-01T00:00:00Z"));
 * InMemoryExecutionStore store = new InMemoryExecutionStore(time);
 *
 * time.advanceSeconds(30);
 * store.findDueRetries(time.instant(), 10);
 * }</pre>
 */
public class TimeController extends Clock {

    private final AtomicReference<Instant> currentTime;
    private final ZoneId zone;

    public TimeController(Instant startTime) {
        this(new AtomicReference<>(startTime), ZoneOffset.UTC);
    }

    private TimeController(AtomicReference<Instant> currentTime, ZoneId zone) {
        this.currentTime = currentTime;
        this.zone = zone;
    }

    public static TimeController frozenAt(Instant time) {
        return new TimeController(time);
    }

    public static TimeController frozen() {
        return new TimeController(Instant.parse("2024-01-15T10:00:00Z"));
    }

    @Override
    public Instant instant() {
        return currentTime.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Shares the underlying time with the returned clock.
     */
    @Override
    public Clock withZone(ZoneId newZone) {
        return new TimeController(currentTime, newZone);
    }

    public void advance(Duration duration) {
        currentTime.updateAndGet(t -> t.plus(duration));
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    public void advanceMinutes(long minutes) {
        advance(Duration.ofMinutes(minutes));
    }

    public void setTime(Instant newTime) {
        currentTime.set(newTime);
    }

    public Duration durationSince(Instant since) {
        return Duration.between(since, instant());
    }
}
