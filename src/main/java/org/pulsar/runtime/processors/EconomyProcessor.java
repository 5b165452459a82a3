package org.pulsar.runtime.processors;

import com.typesafe.config.Config;
import org.pulsar.runtime.GameConstants;
import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.model.Colony;
import org.pulsar.runtime.model.GameEvent;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.pulse.SubpulseContext;

/**
 * Runs colony production in fixed economic cycles.
 * <p>
 * Each colony accumulates elapsed time; every completed cycle adds its production to the
 * stockpile. The processor asks for subpulses to end on the next cycle boundary so that
 * production lands on the correct date.
 */
public class EconomyProcessor extends AbstractRegionProcessor {

    private final long cycleSeconds;

    public EconomyProcessor() {
        this(GameConstants.ECONOMY_CYCLE_SECONDS);
    }

    /**
     * @param cycleSeconds Length of one economic cycle, must be > 0.
     */
    public EconomyProcessor(long cycleSeconds) {
        if (cycleSeconds <= 0) {
            throw new IllegalArgumentException("cycleSeconds must be > 0, got " + cycleSeconds);
        }
        this.cycleSeconds = cycleSeconds;
    }

    /**
     * Config-based constructor used by {@link ProcessorFactory}.
     * @param options Processor options; {@code cycleSeconds} defaults to one day.
     */
    public EconomyProcessor(Config options) {
        this(options.hasPath("cycleSeconds") ? options.getLong("cycleSeconds") : GameConstants.ECONOMY_CYCLE_SECONDS);
    }

    @Override
    protected void processSystem(Simulation simulation, StarSystem system, long deltaSeconds, SubpulseContext context) {
        for (Colony colony : system.getColonies()) {
            long elapsed = colony.getSecondsIntoCycle() + deltaSeconds;
            long cycles = elapsed / cycleSeconds;
            if (cycles > 0) {
                long produced = cycles * colony.getProductionPerCycle();
                colony.addToStockpile(produced);
                simulation.getEventLog().add(new GameEvent(context.getSubpulseEnd(), GameEvent.ECONOMY_CYCLE, system.getId(),
                        String.format("%s produced %d over %d cycle(s)", colony.getName(), produced, cycles)));
            }
            colony.setSecondsIntoCycle(elapsed % cycleSeconds);
            context.requestSubpulseLimit(cycleSeconds - colony.getSecondsIntoCycle());
        }
    }

    public long getCycleSeconds() {
        return cycleSeconds;
    }
}
