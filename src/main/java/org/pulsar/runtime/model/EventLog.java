package org.pulsar.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Chronological record of notable simulation events. Written by processors and the
 * simulation during a pulse, read by the caller between pulses.
 * <p>
 * Events are kept until they are removed. Long-running callers should {@link #drain()} the
 * log after each pulse, otherwise it grows with every economy cycle and arrival.
 */
public class EventLog {

    private final List<GameEvent> events = new ArrayList<>();

    public void add(GameEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * @return An unmodifiable view of all events, oldest first.
     */
    public List<GameEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<GameEvent> getEvents(String type) {
        return events.stream().filter(e -> e.type().equals(type)).toList();
    }

    /**
     * Removes and returns every recorded event.
     * @return The events recorded since the last drain or clear, oldest first.
     */
    public List<GameEvent> drain() {
        List<GameEvent> drained = List.copyOf(events);
        events.clear();
        return drained;
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
