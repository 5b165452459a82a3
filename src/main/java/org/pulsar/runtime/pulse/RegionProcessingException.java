package org.pulsar.runtime.pulse;

import java.util.UUID;

/**
 * Thrown by a processor to tag a failure with the star system it was processing.
 * The pipeline lifts the system id into the resulting {@link ProcessorFaultException}.
 */
public class RegionProcessingException extends RuntimeException {

    private final UUID regionId;

    public RegionProcessingException(UUID regionId, Throwable cause) {
        super("Failed to process system " + regionId + ": " + cause.getMessage(), cause);
        this.regionId = regionId;
    }

    public UUID getRegionId() {
        return regionId;
    }
}
