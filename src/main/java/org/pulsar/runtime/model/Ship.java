package org.pulsar.runtime.model;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A ship travelling inside a star system.
 */
public class Ship {

    private final UUID id;
    private final String name;
    private final double speedKmPerSecond;
    private Vector2 position;
    private UUID destinationBodyId;

    public Ship(UUID id, String name, Vector2 position, double speedKmPerSecond) {
        if (!Double.isFinite(speedKmPerSecond) || speedKmPerSecond <= 0) {
            throw new IllegalArgumentException("Ship speed must be finite and > 0: " + speedKmPerSecond);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.position = Objects.requireNonNull(position, "position");
        this.speedKmPerSecond = speedKmPerSecond;
    }

    public UUID getId() { return id; }

    public String getName() { return name; }

    public double getSpeedKmPerSecond() { return speedKmPerSecond; }

    public Vector2 getPosition() { return position; }

    public void setPosition(Vector2 position) { this.position = Objects.requireNonNull(position, "position"); }

    public Optional<UUID> getDestinationBodyId() { return Optional.ofNullable(destinationBodyId); }

    /**
     * Orders the ship to travel to a body.
     * @param bodyId The destination body, {@code null} to stop.
     */
    public void setDestination(UUID bodyId) { this.destinationBodyId = bodyId; }

    public void clearDestination() { this.destinationBodyId = null; }

    @Override
    public String toString() {
        return "Ship{" + name + " at " + position + "}";
    }
}
