package org.pulsar.runtime.pulse;

import java.util.Optional;

/**
 * Result of one {@code advance} call.
 *
 * @param requestedSeconds The duration the caller asked for.
 * @param quantizedSeconds The request after quantization to the minimum timestep.
 * @param secondsAdvanced  Simulated seconds actually committed to the clock.
 * @param subpulseCount    Number of subpulses whose pipeline pass ran.
 * @param outcome          How the pulse ended.
 * @param interrupt        The interrupt that stopped the pulse, {@code null} unless interrupted.
 */
public record PulseResult(
    long requestedSeconds,
    long quantizedSeconds,
    long secondsAdvanced,
    int subpulseCount,
    PulseOutcome outcome,
    PulseInterrupt interrupt
) {

    public boolean isCompleted() {
        return outcome == PulseOutcome.COMPLETED;
    }

    public boolean isInterrupted() {
        return outcome == PulseOutcome.INTERRUPTED;
    }

    public boolean isCancelled() {
        return outcome == PulseOutcome.CANCELLED;
    }

    public Optional<PulseInterrupt> interruptIfAny() {
        return Optional.ofNullable(interrupt);
    }
}
