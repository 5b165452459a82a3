package org.pulsar.runtime.processors;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.SimulationSettings;
import org.pulsar.runtime.model.GameEvent;
import org.pulsar.runtime.model.OrbitingBody;
import org.pulsar.runtime.model.Ship;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.model.Vector2;
import org.pulsar.runtime.pulse.InterruptRegister;
import org.pulsar.runtime.pulse.RegionProcessingException;
import org.pulsar.runtime.pulse.SubpulseContext;
import org.pulsar.runtime.pulse.SubpulseLimit;
import org.pulsar.runtime.util.GameMath;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ShipMovementProcessorTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2050, 1, 1, 0, 0);
    // One AU in 1000 seconds.
    private static final double SPEED = GameMath.KM_PER_AU / 1000.0;

    private Simulation simulation;
    private StarSystem system;
    private OrbitingBody target;
    private Ship ship;
    private SubpulseLimit limit;
    private InterruptRegister interrupts;

    @BeforeEach
    void setUp() {
        simulation = new Simulation(SimulationSettings.defaults("test"));
        target = new OrbitingBody(UUID.randomUUID(), "Target", 1.0, 0.0, 0.0);
        ship = new Ship(UUID.randomUUID(), "Scout", Vector2.ZERO, SPEED);
        ship.setDestination(target.getId());
        system = new StarSystem(UUID.randomUUID(), "Sol").addBody(target).addShip(ship);
        limit = new SubpulseLimit();
        interrupts = new InterruptRegister();
    }

    private SubpulseContext context(long delta) {
        return new SubpulseContext(0, delta, T0.plusSeconds(delta), limit, interrupts);
    }

    @Test
    void process_movesShipTowardDestinationAndRequestsArrivalCheckpoint() {
        new ShipMovementProcessor().process(simulation, List.of(system), 400, context(400));

        assertThat(ship.getPosition().x()).isCloseTo(0.4, within(1e-9));
        assertThat(ship.getPosition().y()).isCloseTo(0.0, within(1e-9));
        assertThat(ship.getDestinationBodyId()).contains(target.getId());
        assertThat(limit.read()).isBetween(600L, 601L);
        assertThat(interrupts.isSet()).isFalse();
    }

    @Test
    void process_arrivalSnapsToBodyLogsEventAndInterrupts() {
        new ShipMovementProcessor().process(simulation, List.of(system), 1500, context(1500));

        assertThat(ship.getPosition()).isEqualTo(target.getPosition());
        assertThat(ship.getDestinationBodyId()).isEmpty();
        assertThat(simulation.getEventLog().getEvents(GameEvent.SHIP_ARRIVED))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.message()).isEqualTo("Scout arrived at Target");
                    assertThat(e.systemId()).isEqualTo(system.getId());
                    assertThat(e.dateTime()).isEqualTo(T0.plusSeconds(1500));
                });
        assertThat(interrupts.current()).hasValueSatisfying(i -> {
            assertThat(i.reason()).isEqualTo("Scout arrived at Target");
            assertThat(i.source()).contains(ship.getId().toString());
        });
        assertThat(limit.isBounded()).isFalse();
    }

    @Test
    void process_arrivalWithoutInterruptWhenDisabled() {
        ShipMovementProcessor processor = new ShipMovementProcessor(
                ConfigFactory.parseString("interruptOnArrival = false"));

        processor.process(simulation, List.of(system), 1500, context(1500));

        assertThat(ship.getDestinationBodyId()).isEmpty();
        assertThat(simulation.getEventLog().size()).isEqualTo(1);
        assertThat(interrupts.isSet()).isFalse();
    }

    @Test
    void process_ignoresShipsWithoutDestination() {
        ship.clearDestination();

        new ShipMovementProcessor().process(simulation, List.of(system), 400, context(400));

        assertThat(ship.getPosition()).isEqualTo(Vector2.ZERO);
        assertThat(limit.isBounded()).isFalse();
    }

    @Test
    void process_unknownDestinationFailsWithRegionId() {
        ship.setDestination(UUID.randomUUID());

        assertThatThrownBy(() -> new ShipMovementProcessor().process(simulation, List.of(system), 400, context(400)))
                .isInstanceOfSatisfying(RegionProcessingException.class, e -> {
                    assertThat(e.getRegionId()).isEqualTo(system.getId());
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class)
                            .hasMessageContaining("Scout");
                });
    }
}
