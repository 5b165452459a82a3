package org.pulsar.runtime.model;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Holds the current simulated date-time of a simulation instance.
 * <p>
 * The clock has second granularity and only ever moves forward. It is advanced by the
 * pulse scheduler between subpulses and read by every processor.
 */
public final class GameClock {

    private LocalDateTime currentDateTime;

    /**
     * Creates a clock starting at the given date-time. Sub-second precision is dropped.
     * @param start The initial simulated date-time.
     */
    public GameClock(LocalDateTime start) {
        this.currentDateTime = Objects.requireNonNull(start, "start").truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Returns the current simulated date-time.
     * @return The current date-time.
     */
    public LocalDateTime now() {
        return currentDateTime;
    }

    /**
     * Moves the clock forward.
     * @param seconds The number of seconds to advance, must be >= 0.
     * @return The new date-time.
     * @throws IllegalArgumentException if {@code seconds} is negative.
     */
    public LocalDateTime advance(long seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Clock cannot move backwards: " + seconds + "s");
        }
        currentDateTime = currentDateTime.plusSeconds(seconds);
        return currentDateTime;
    }

    /**
     * Returns how many whole seconds the clock can still advance before it leaves the
     * {@link LocalDateTime} range.
     * @return The remaining representable seconds, never negative.
     */
    public long secondsRemaining() {
        return ChronoUnit.SECONDS.between(currentDateTime, LocalDateTime.MAX);
    }

    @Override
    public String toString() {
        return "GameClock{" + currentDateTime + "}";
    }
}
