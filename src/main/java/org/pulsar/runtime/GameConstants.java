package org.pulsar.runtime;

import java.time.LocalDateTime;

/**
 * Default values for simulation settings. Not meant to be instantiated.
 */
public final class GameConstants {

    private GameConstants() {}

    /**
     * Default granularity of time advancement. All pulse requests are quantized to multiples of it.
     */
    public static final long MINIMUM_TIMESTEP = 5;

    /**
     * Default simulated start date of a new game.
     */
    public static final LocalDateTime DEFAULT_START_DATE_TIME = LocalDateTime.of(2050, 1, 1, 0, 0);

    /**
     * Length of one economic cycle (one simulated day).
     */
    public static final long ECONOMY_CYCLE_SECONDS = 86_400;

    /**
     * A maxSystems value meaning "no limit".
     */
    public static final int UNLIMITED_SYSTEMS = 0;
}
