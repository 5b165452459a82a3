package org.pulsar.runtime.spi;

import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.pulse.SubpulseContext;

import java.util.List;

/**
 * A unit of simulation logic executed once per subpulse.
 * <p>
 * Processors are executed sequentially in their configured order, and processor N+1 observes
 * the state left by processor N. A processor may shorten the next subpulse or interrupt the
 * pulse through the {@link SubpulseContext}, but must never call back into the scheduler.
 * <p>
 * Processors built from configuration must provide a constructor with signature
 * {@code (com.typesafe.config.Config options)}.
 */
public interface ISubpulseProcessor {

    /**
     * Processes one subpulse.
     *
     * @param simulation   The simulation instance (clock, event log, settings).
     * @param systems      Snapshot of the active star systems for this subpulse.
     * @param deltaSeconds Length of the current subpulse in seconds.
     * @param context      Subpulse negotiation and interrupt handle.
     */
    void process(Simulation simulation, List<StarSystem> systems, long deltaSeconds, SubpulseContext context);

    /**
     * @return Name used in logs and fault reports.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
