package org.pulsar.runtime.pulse;

/**
 * The negotiated upper bound on the length of the next subpulse.
 * <p>
 * Processors shorten it while they run when they know an event needs finer time resolution
 * (an arrival, an economic cycle). The scheduler reads it at the subpulse boundary and then
 * resets it, so a request made during subpulse N bounds subpulse N+1. The effective limit is
 * the minimum over all requests since the last reset.
 * <p>
 * Not thread-safe: only the thread running the pipeline may touch it.
 */
public final class SubpulseLimit {

    /**
     * Value of an unbounded limit.
     */
    public static final long UNBOUNDED = Long.MAX_VALUE;

    private long maxSeconds = UNBOUNDED;

    /**
     * Clears all requests, making the limit unbounded.
     */
    public void reset() {
        maxSeconds = UNBOUNDED;
    }

    /**
     * Requests that the next subpulse last at most {@code seconds}. A request can only shorten
     * the limit, never extend it.
     *
     * @param seconds The requested maximum subpulse length, must be > 0.
     * @throws IllegalArgumentException if {@code seconds} is not positive.
     */
    public void request(long seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("Subpulse limit must be positive, got " + seconds);
        }
        maxSeconds = Math.min(maxSeconds, seconds);
    }

    /**
     * @return The current limit in seconds, {@link #UNBOUNDED} if nobody requested one.
     */
    public long read() {
        return maxSeconds;
    }

    /**
     * @return {@code true} if a request was made since the last reset.
     */
    public boolean isBounded() {
        return maxSeconds != UNBOUNDED;
    }

    @Override
    public String toString() {
        return isBounded() ? "SubpulseLimit{" + maxSeconds + "s}" : "SubpulseLimit{unbounded}";
    }
}
