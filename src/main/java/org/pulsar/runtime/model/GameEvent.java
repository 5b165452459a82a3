package org.pulsar.runtime.model;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * An entry of the simulation's event log.
 *
 * @param dateTime Simulated date-time of the event.
 * @param type     Event category, e.g. {@code SHIP_ARRIVED}.
 * @param systemId The system the event happened in, {@code null} for global events.
 * @param message  Human-readable description.
 */
public record GameEvent(LocalDateTime dateTime, String type, UUID systemId, String message) {

    public static final String SHIP_ARRIVED = "SHIP_ARRIVED";
    public static final String ECONOMY_CYCLE = "ECONOMY_CYCLE";
    public static final String PULSE_INTERRUPTED = "PULSE_INTERRUPTED";
}
