package org.pulsar.runtime.processors;

import com.typesafe.config.Config;
import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.model.OrbitingBody;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.pulse.SubpulseContext;
import org.pulsar.runtime.util.GameMath;

/**
 * Moves every orbiting body along its circular orbit by the elapsed subpulse time.
 * Runs first in the default pipeline so later processors see this subpulse's positions.
 */
public class OrbitProcessor extends AbstractRegionProcessor {

    public OrbitProcessor() {
    }

    /**
     * Config-based constructor used by {@link ProcessorFactory}. Takes no options.
     * @param options Processor options.
     */
    public OrbitProcessor(Config options) {
        this();
    }

    @Override
    protected void processSystem(Simulation simulation, StarSystem system, long deltaSeconds, SubpulseContext context) {
        for (OrbitingBody body : system.getBodies()) {
            if (body.isStationary()) {
                continue;
            }
            double delta = GameMath.TWO_PI * deltaSeconds / body.getOrbitalPeriodSeconds();
            body.setMeanAnomaly(GameMath.Angle.normaliseRadiansPositive(body.getMeanAnomaly() + delta));
        }
    }
}
