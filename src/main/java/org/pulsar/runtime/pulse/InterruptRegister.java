package org.pulsar.runtime.pulse;

import java.util.Objects;
import java.util.Optional;

/**
 * Single-slot holder for the interrupt of the current pulse. The first raiser wins; later
 * raises are ignored until the slot is cleared, which the scheduler does at the top of every
 * {@code advance} call.
 */
public final class InterruptRegister {

    private PulseInterrupt current;

    /**
     * Stores the interrupt unless one is already set.
     * @param interrupt The interrupt to raise.
     * @return {@code true} if this interrupt was stored, {@code false} if another one won.
     */
    public boolean raise(PulseInterrupt interrupt) {
        Objects.requireNonNull(interrupt, "interrupt");
        if (current != null) {
            return false;
        }
        current = interrupt;
        return true;
    }

    public boolean isSet() {
        return current != null;
    }

    public Optional<PulseInterrupt> current() {
        return Optional.ofNullable(current);
    }

    public void clear() {
        current = null;
    }
}
