package org.pulsar.runtime.setup;

import com.typesafe.config.Config;
import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.SimulationSettings;
import org.pulsar.runtime.model.Colony;
import org.pulsar.runtime.model.OrbitingBody;
import org.pulsar.runtime.model.Ship;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.model.Vector2;
import org.pulsar.runtime.util.GameMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Creates a ready-to-run simulation from the application configuration.
 * <p>
 * Reads {@code pulsar.simulation} into {@link SimulationSettings}, creates the star systems
 * listed under {@code pulsar.systems}, and then calls {@link Simulation#onReady()}.
 * Entity ids are derived from names, so the same configuration always yields the same ids.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * pulsar.systems = [
 *   {
 *     name = "Sol"
 *     bodies = [
 *       { name = "Sun" }
 *       { name = "Earth", orbitRadiusAu = 1.0, orbitalPeriodSeconds = 31557600, meanAnomalyDegrees = 0 }
 *     ]
 *     ships = [ { name = "Scout", startBody = "Earth", speedKmPerSecond = 50, destination = "Mars" } ]
 *     colonies = [ { name = "Earth Colony", body = "Earth", productionPerCycle = 100 } ]
 *   }
 * ]
 * </pre>
 */
public final class SimulationBootstrap {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationBootstrap.class);

    public static final String SIMULATION_PATH = "pulsar.simulation";
    public static final String SYSTEMS_PATH = "pulsar.systems";

    private SimulationBootstrap() {}

    /**
     * Creates, populates and readies a simulation.
     * @param config The resolved application configuration.
     * @return A simulation on which time can be advanced.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public static Simulation fromConfig(Config config) {
        SimulationSettings settings = SimulationSettings.fromConfig(
                config.hasPath(SIMULATION_PATH) ? config.getConfig(SIMULATION_PATH) : null);
        Simulation simulation = new Simulation(settings);

        if (config.hasPath(SYSTEMS_PATH)) {
            for (Config systemConfig : config.getConfigList(SYSTEMS_PATH)) {
                simulation.addSystem(createSystem(systemConfig));
            }
        }
        LOG.debug("Bootstrapped {} systems for '{}'", simulation.getActiveSystems().size(), settings.name());

        simulation.onReady();
        return simulation;
    }

    /**
     * Builds one star system from its config block.
     * @param systemConfig The system definition.
     * @return The system.
     */
    public static StarSystem createSystem(Config systemConfig) {
        String systemName = systemConfig.getString("name");
        StarSystem system = new StarSystem(deriveId(systemName), systemName);

        for (Config bodyConfig : listOrEmpty(systemConfig, "bodies")) {
            String bodyName = bodyConfig.getString("name");
            system.addBody(new OrbitingBody(
                    deriveId(systemName + "/" + bodyName),
                    bodyName,
                    doubleOrDefault(bodyConfig, "orbitRadiusAu", 0.0),
                    doubleOrDefault(bodyConfig, "orbitalPeriodSeconds", 0.0),
                    GameMath.Angle.toRadians(doubleOrDefault(bodyConfig, "meanAnomalyDegrees", 0.0))));
        }

        for (Config shipConfig : listOrEmpty(systemConfig, "ships")) {
            String shipName = shipConfig.getString("name");
            Vector2 start = shipConfig.hasPath("startBody")
                    ? requireBody(system, shipConfig.getString("startBody")).getPosition()
                    : Vector2.ZERO;
            Ship ship = new Ship(deriveId(systemName + "/ship/" + shipName), shipName, start,
                    shipConfig.getDouble("speedKmPerSecond"));
            if (shipConfig.hasPath("destination")) {
                ship.setDestination(requireBody(system, shipConfig.getString("destination")).getId());
            }
            system.addShip(ship);
        }

        for (Config colonyConfig : listOrEmpty(systemConfig, "colonies")) {
            String colonyName = colonyConfig.getString("name");
            system.addColony(new Colony(
                    deriveId(systemName + "/colony/" + colonyName),
                    colonyName,
                    requireBody(system, colonyConfig.getString("body")).getId(),
                    colonyConfig.getLong("productionPerCycle"),
                    colonyConfig.hasPath("stockpile") ? colonyConfig.getLong("stockpile") : 0L));
        }
        return system;
    }

    /**
     * @param name A stable entity name.
     * @return A name-based (type 3) UUID.
     */
    public static UUID deriveId(String name) {
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    private static OrbitingBody requireBody(StarSystem system, String bodyName) {
        return system.findBodyByName(bodyName).orElseThrow(() ->
                new IllegalArgumentException("Unknown body '" + bodyName + "' in system '" + system.getName() + "'"));
    }

    private static List<? extends Config> listOrEmpty(Config config, String path) {
        return config.hasPath(path) ? config.getConfigList(path) : List.of();
    }

    private static double doubleOrDefault(Config config, String path, double defaultValue) {
        return config.hasPath(path) ? config.getDouble(path) : defaultValue;
    }
}
