package org.pulsar.runtime.pulse;

import java.util.Optional;
import java.util.UUID;

/**
 * A processor failed during a pipeline pass. This ends the {@code advance} call; state mutated
 * by the failing subpulse is not rolled back.
 */
public class ProcessorFaultException extends RuntimeException {

    private final String processorName;
    private final long subpulseIndex;
    private final UUID regionId;

    /**
     * @param processorName Name of the failing processor.
     * @param subpulseIndex Zero-based index of the subpulse within the pulse.
     * @param regionId      The star system being processed, {@code null} if unknown.
     * @param cause         The underlying failure.
     */
    public ProcessorFaultException(String processorName, long subpulseIndex, UUID regionId, Throwable cause) {
        super(String.format("Processor '%s' failed in subpulse %d%s: %s",
                processorName, subpulseIndex,
                regionId != null ? " (system " + regionId + ")" : "",
                cause.getMessage()), cause);
        this.processorName = processorName;
        this.subpulseIndex = subpulseIndex;
        this.regionId = regionId;
    }

    public String getProcessorName() {
        return processorName;
    }

    public long getSubpulseIndex() {
        return subpulseIndex;
    }

    public Optional<UUID> getRegionId() {
        return Optional.ofNullable(regionId);
    }
}
