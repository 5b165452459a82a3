package org.pulsar.runtime.pulse;

/**
 * How a pulse ended.
 */
public enum PulseOutcome {
    /**
     * The whole (quantized) request was advanced.
     */
    COMPLETED,
    /**
     * A processor raised an interrupt; the caller should inspect it before advancing further.
     */
    INTERRUPTED,
    /**
     * The cancellation token was honoured at a subpulse boundary.
     */
    CANCELLED
}
