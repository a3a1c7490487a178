package com.devicehub.config;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Provider for the time sources used by the component manager.
 *
 * <p>Wraps a {@link java.time.Clock} for wall-clock timestamps (component start times)
 * and a {@link NanoTimeSource} for elapsed-time measurement (readiness waits, shutdown
 * grace periods). Tests substitute a fixed clock to get deterministic timestamps.</p>
 *
 * <pre>{@code
 * ClockProvider clock = ClockProvider.system();
 * Instant startedAt = clock.instant();
 *
 * ClockProvider testClock = ClockProvider.fixed(Instant.parse("2024-01-15T10:30:00Z"), ZoneId.of("UTC"));
 * }</pre>
 */
public class ClockProvider {

    private final Clock clock;
    private final NanoTimeSource nanoTimeSource;

    /**
     * Functional interface for providing high-resolution elapsed time.
     */
    @FunctionalInterface
    public interface NanoTimeSource {
        /**
         * @return nanoseconds since some fixed but arbitrary origin time
         */
        long nanoTime();
    }

    public ClockProvider(Clock clock, NanoTimeSource nanoTimeSource) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        if (nanoTimeSource == null) {
            throw new IllegalArgumentException("NanoTimeSource cannot be null");
        }
        this.clock = clock;
        this.nanoTimeSource = nanoTimeSource;
    }

    public ClockProvider(Clock clock) {
        this(clock, System::nanoTime);
    }

    /**
     * Create a ClockProvider backed by the system UTC clock and {@link System#nanoTime()}.
     */
    public static ClockProvider system() {
        return new ClockProvider(Clock.systemUTC(), System::nanoTime);
    }

    /**
     * Create a ClockProvider that always reports the same instant.
     * Elapsed time still comes from {@link System#nanoTime()}.
     */
    public static ClockProvider fixed(Instant fixedInstant, ZoneId zone) {
        return new ClockProvider(Clock.fixed(fixedInstant, zone), System::nanoTime);
    }

    public Clock getClock() {
        return clock;
    }

    public Instant instant() {
        return clock.instant();
    }

    public long currentTimeMillis() {
        return clock.millis();
    }

    public long nanoTime() {
        return nanoTimeSource.nanoTime();
    }

    /**
     * Time elapsed since a previous {@link #nanoTime()} reading.
     *
     * @param startNanos an earlier value of {@link #nanoTime()}
     * @return the elapsed duration, never negative
     */
    public Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0, nanoTime() - startNanos));
    }

    @Override
    public String toString() {
        return "ClockProvider{clock=" + clock + "}";
    }
}
