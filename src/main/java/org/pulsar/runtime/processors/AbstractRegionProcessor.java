package org.pulsar.runtime.processors;

import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.pulse.RegionProcessingException;
import org.pulsar.runtime.pulse.SubpulseContext;
import org.pulsar.runtime.spi.ISubpulseProcessor;

import java.util.List;

/**
 * Base class for processors that handle each star system independently. Failures are tagged
 * with the id of the system being processed.
 */
public abstract class AbstractRegionProcessor implements ISubpulseProcessor {

    @Override
    public final void process(Simulation simulation, List<StarSystem> systems, long deltaSeconds, SubpulseContext context) {
        for (StarSystem system : systems) {
            try {
                processSystem(simulation, system, deltaSeconds, context);
            } catch (RegionProcessingException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new RegionProcessingException(system.getId(), e);
            }
        }
    }

    /**
     * Processes one star system for the current subpulse.
     *
     * @param simulation   The simulation instance.
     * @param system       The system to update.
     * @param deltaSeconds Length of the current subpulse in seconds.
     * @param context      Subpulse negotiation and interrupt handle.
     */
    protected abstract void processSystem(Simulation simulation, StarSystem system, long deltaSeconds, SubpulseContext context);
}
