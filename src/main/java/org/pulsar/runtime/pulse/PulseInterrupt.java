package org.pulsar.runtime.pulse;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * A request, raised by a processor, to stop advancing time after the current subpulse.
 *
 * @param reason    Human-readable reason the caller can act on.
 * @param sourceId  Identifier of the originating entity or processor, may be {@code null}.
 * @param raisedAt  Simulated date-time at which the interrupt was raised.
 */
public record PulseInterrupt(String reason, String sourceId, LocalDateTime raisedAt) {

    public PulseInterrupt {
        Objects.requireNonNull(reason, "reason");
        if (reason.isBlank()) {
            throw new IllegalArgumentException("Interrupt reason must not be blank");
        }
        Objects.requireNonNull(raisedAt, "raisedAt");
    }

    /**
     * @return The originating entity or processor, if known.
     */
    public Optional<String> source() {
        return Optional.ofNullable(sourceId);
    }
}
