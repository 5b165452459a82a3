package org.pulsar.runtime.pulse;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Per-subpulse view handed to every processor of the pipeline.
 * <p>
 * Processors use it to negotiate the length of the next subpulse and to interrupt the pulse.
 * Both operations are write-only from the processor's point of view; the scheduler is the only
 * reader, at the subpulse boundary.
 */
public final class SubpulseContext {

    private final long subpulseIndex;
    private final long deltaSeconds;
    private final LocalDateTime subpulseEnd;
    private final SubpulseLimit subpulseLimit;
    private final InterruptRegister interrupts;

    /**
     * @param subpulseIndex Zero-based index of the subpulse within the current pulse.
     * @param deltaSeconds  Length of this subpulse in seconds.
     * @param subpulseEnd   Simulated date-time at the end of this subpulse (the clock value the
     *                      processors observe).
     * @param subpulseLimit The simulation's subpulse limit register.
     * @param interrupts    The simulation's interrupt register.
     */
    public SubpulseContext(long subpulseIndex, long deltaSeconds, LocalDateTime subpulseEnd,
                           SubpulseLimit subpulseLimit, InterruptRegister interrupts) {
        this.subpulseIndex = subpulseIndex;
        this.deltaSeconds = deltaSeconds;
        this.subpulseEnd = Objects.requireNonNull(subpulseEnd, "subpulseEnd");
        this.subpulseLimit = Objects.requireNonNull(subpulseLimit, "subpulseLimit");
        this.interrupts = Objects.requireNonNull(interrupts, "interrupts");
    }

    public long getSubpulseIndex() {
        return subpulseIndex;
    }

    public long getDeltaSeconds() {
        return deltaSeconds;
    }

    public LocalDateTime getSubpulseEnd() {
        return subpulseEnd;
    }

    /**
     * Asks for the next subpulse to last at most {@code seconds}.
     * @param seconds Maximum length of the next subpulse, must be > 0.
     */
    public void requestSubpulseLimit(long seconds) {
        subpulseLimit.request(seconds);
    }

    /**
     * Raises an interrupt stamped with the end of this subpulse.
     * @param reason   Why advancement must stop.
     * @param sourceId Originating entity or processor, may be {@code null}.
     * @return {@code true} if this interrupt was stored, {@code false} if one was already set.
     */
    public boolean raiseInterrupt(String reason, String sourceId) {
        return interrupts.raise(new PulseInterrupt(reason, sourceId, subpulseEnd));
    }

    /**
     * @return {@code true} if some processor already interrupted the current pulse.
     */
    public boolean isInterruptRaised() {
        return interrupts.isSet();
    }
}
