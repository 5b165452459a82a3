package org.pulsar.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings of a simulation instance.
 *
 * @param name            Name of the game.
 * @param startDateTime   Simulated date-time the clock starts at.
 * @param minimumTimestep Granularity of time advancement in seconds, >= 1.
 * @param maxSystems      Maximum number of systems, {@link GameConstants#UNLIMITED_SYSTEMS} for no limit.
 * @param processors      Processor definitions ({@code className}, optional {@code options}) in
 *                        pipeline order.
 */
public record SimulationSettings(
    String name,
    LocalDateTime startDateTime,
    long minimumTimestep,
    int maxSystems,
    List<? extends Config> processors
) {

    public SimulationSettings {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(startDateTime, "startDateTime");
        if (minimumTimestep < 1) {
            throw new IllegalArgumentException("minimumTimestep must be >= 1, got " + minimumTimestep);
        }
        if (maxSystems < 0) {
            throw new IllegalArgumentException("maxSystems must be >= 0, got " + maxSystems);
        }
        processors = processors != null ? List.copyOf(processors) : List.of();
    }

    /**
     * Settings with defaults and no configured processors.
     * @param name Name of the game.
     * @return The settings.
     */
    public static SimulationSettings defaults(String name) {
        return new SimulationSettings(name, GameConstants.DEFAULT_START_DATE_TIME,
                GameConstants.MINIMUM_TIMESTEP, GameConstants.UNLIMITED_SYSTEMS, List.of());
    }

    /**
     * Reads settings from a {@code pulsar.simulation} style config block. Missing keys fall back
     * to {@link GameConstants}.
     *
     * @param config The simulation config block.
     * @return The validated settings.
     * @throws IllegalArgumentException if a value is invalid.
     */
    public static SimulationSettings fromConfig(Config config) {
        Config options = config != null ? config : ConfigFactory.empty();
        String name = options.hasPath("name") ? options.getString("name") : "Pulsar";
        LocalDateTime start = GameConstants.DEFAULT_START_DATE_TIME;
        if (options.hasPath("startDateTime")) {
            try {
                start = LocalDateTime.parse(options.getString("startDateTime"));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid startDateTime: " + options.getString("startDateTime"), e);
            }
        }
        long minimumTimestep = options.hasPath("minimumTimestep")
                ? options.getLong("minimumTimestep") : GameConstants.MINIMUM_TIMESTEP;
        int maxSystems = options.hasPath("maxSystems")
                ? options.getInt("maxSystems") : GameConstants.UNLIMITED_SYSTEMS;
        List<? extends Config> processors = options.hasPath("processors")
                ? options.getConfigList("processors") : List.of();
        return new SimulationSettings(name, start, minimumTimestep, maxSystems, processors);
    }
}
