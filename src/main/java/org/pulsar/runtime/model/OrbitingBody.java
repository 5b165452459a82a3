package org.pulsar.runtime.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A star, planet or moon on a circular orbit around its system's origin.
 * A body with an orbital period of 0 is stationary (the primary).
 */
public class OrbitingBody {

    private final UUID id;
    private final String name;
    private final double orbitRadiusAu;
    private final double orbitalPeriodSeconds;
    private double meanAnomaly;

    /**
     * @param id                   Unique id of the body.
     * @param name                 Display name.
     * @param orbitRadiusAu        Radius of the circular orbit in AU, must be >= 0.
     * @param orbitalPeriodSeconds Time for one full orbit, 0 for a stationary body.
     * @param meanAnomaly          Initial mean anomaly in radians.
     */
    public OrbitingBody(UUID id, String name, double orbitRadiusAu, double orbitalPeriodSeconds, double meanAnomaly) {
        if (!Double.isFinite(orbitRadiusAu) || orbitRadiusAu < 0) {
            throw new IllegalArgumentException("Orbit radius must be finite and >= 0: " + orbitRadiusAu);
        }
        if (!Double.isFinite(orbitalPeriodSeconds) || orbitalPeriodSeconds < 0) {
            throw new IllegalArgumentException("Orbital period must be finite and >= 0: " + orbitalPeriodSeconds);
        }
        if (!Double.isFinite(meanAnomaly)) {
            throw new IllegalArgumentException("Mean anomaly must be finite: " + meanAnomaly);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.orbitRadiusAu = orbitRadiusAu;
        this.orbitalPeriodSeconds = orbitalPeriodSeconds;
        this.meanAnomaly = meanAnomaly;
    }

    public UUID getId() { return id; }

    public String getName() { return name; }

    public double getOrbitRadiusAu() { return orbitRadiusAu; }

    public double getOrbitalPeriodSeconds() { return orbitalPeriodSeconds; }

    public boolean isStationary() { return orbitalPeriodSeconds == 0.0; }

    public double getMeanAnomaly() { return meanAnomaly; }

    public void setMeanAnomaly(double meanAnomaly) { this.meanAnomaly = meanAnomaly; }

    /**
     * @return The body's current position in AU, derived from its mean anomaly.
     */
    public Vector2 getPosition() {
        return new Vector2(orbitRadiusAu * Math.cos(meanAnomaly), orbitRadiusAu * Math.sin(meanAnomaly));
    }

    @Override
    public String toString() {
        return "OrbitingBody{" + name + ", r=" + orbitRadiusAu + "AU}";
    }
}
