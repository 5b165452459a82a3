package org.pulsar.runtime.model;

/**
 * Immutable 2-D position or displacement, in AU unless stated otherwise.
 */
public record Vector2(double x, double y) {

    public static final Vector2 ZERO = new Vector2(0.0, 0.0);

    public Vector2 plus(Vector2 other) {
        return new Vector2(x + other.x, y + other.y);
    }

    public Vector2 minus(Vector2 other) {
        return new Vector2(x - other.x, y - other.y);
    }

    public Vector2 scale(double factor) {
        return new Vector2(x * factor, y * factor);
    }

    public double length() {
        return Math.hypot(x, y);
    }
}
