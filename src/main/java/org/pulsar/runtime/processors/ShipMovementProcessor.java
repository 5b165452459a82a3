package org.pulsar.runtime.processors;

import com.typesafe.config.Config;
import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.model.GameEvent;
import org.pulsar.runtime.model.OrbitingBody;
import org.pulsar.runtime.model.Ship;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.model.Vector2;
import org.pulsar.runtime.pulse.SubpulseContext;
import org.pulsar.runtime.util.GameMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

/**
 * Moves ships toward their destination body in a straight line at constant speed.
 * <p>
 * The destination's position is read after the orbit processor has run for the same subpulse.
 * A ship still underway asks for the next subpulse to end at its estimated arrival, so later
 * subpulses do not overshoot it. The first subpulse after new orders is only bounded by limits
 * already in place; callers that give orders between pulses can bound it through
 * {@link org.pulsar.runtime.Simulation#getSubpulseLimit()}.
 * <p>
 * On arrival the ship snaps to the body, an event is logged and, unless disabled, the pulse is
 * interrupted so the player can give new orders.
 */
public class ShipMovementProcessor extends AbstractRegionProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(ShipMovementProcessor.class);

    private final boolean interruptOnArrival;

    public ShipMovementProcessor() {
        this(true);
    }

    /**
     * @param interruptOnArrival Whether an arrival interrupts the pulse.
     */
    public ShipMovementProcessor(boolean interruptOnArrival) {
        this.interruptOnArrival = interruptOnArrival;
    }

    /**
     * Config-based constructor used by {@link ProcessorFactory}.
     * @param options Processor options; {@code interruptOnArrival} defaults to {@code true}.
     */
    public ShipMovementProcessor(Config options) {
        this(!options.hasPath("interruptOnArrival") || options.getBoolean("interruptOnArrival"));
    }

    @Override
    protected void processSystem(Simulation simulation, StarSystem system, long deltaSeconds, SubpulseContext context) {
        for (Ship ship : system.getShips()) {
            Optional<UUID> destinationId = ship.getDestinationBodyId();
            if (destinationId.isEmpty()) {
                continue;
            }
            OrbitingBody destination = system.findBody(destinationId.get()).orElseThrow(() ->
                    new IllegalStateException("Ship '" + ship.getName() + "' is heading to unknown body " + destinationId.get()));

            Vector2 target = destination.getPosition();
            double distanceAu = GameMath.Distance.distanceBetween(ship.getPosition(), target);
            double distanceKm = GameMath.Distance.auToKm(distanceAu);
            double travelKm = ship.getSpeedKmPerSecond() * deltaSeconds;

            if (travelKm >= distanceKm) {
                arrive(simulation, system, ship, destination, context);
                continue;
            }

            Vector2 heading = target.minus(ship.getPosition()).scale(1.0 / distanceAu);
            ship.setPosition(ship.getPosition().plus(heading.scale(GameMath.Distance.kmToAu(travelKm))));

            long secondsToArrival = (long) Math.ceil((distanceKm - travelKm) / ship.getSpeedKmPerSecond());
            context.requestSubpulseLimit(Math.max(1L, secondsToArrival));
        }
    }

    private void arrive(Simulation simulation, StarSystem system, Ship ship, OrbitingBody destination, SubpulseContext context) {
        ship.setPosition(destination.getPosition());
        ship.clearDestination();

        String message = String.format("%s arrived at %s", ship.getName(), destination.getName());
        simulation.getEventLog().add(new GameEvent(context.getSubpulseEnd(), GameEvent.SHIP_ARRIVED, system.getId(), message));
        LOG.debug("{} in system '{}' at {}", message, system.getName(), context.getSubpulseEnd());

        if (interruptOnArrival) {
            context.raiseInterrupt(message, ship.getId().toString());
        }
    }
}
