package org.pulsar.runtime;

import org.pulsar.runtime.model.EventLog;
import org.pulsar.runtime.model.GameClock;
import org.pulsar.runtime.model.GameEvent;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.processors.ProcessorFactory;
import org.pulsar.runtime.pulse.CancellationToken;
import org.pulsar.runtime.pulse.InterruptRegister;
import org.pulsar.runtime.pulse.ProcessorPipeline;
import org.pulsar.runtime.pulse.PulseInterrupt;
import org.pulsar.runtime.pulse.PulseResult;
import org.pulsar.runtime.pulse.PulseScheduler;
import org.pulsar.runtime.pulse.SubpulseLimit;
import org.pulsar.runtime.spi.IRegionProvider;
import org.pulsar.runtime.spi.ISubpulseProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.DoubleConsumer;

/**
 * A simulation instance: the shared clock, the star systems, and the pulse scheduler that
 * advances them.
 * <p>
 * Initialization has two explicit phases. The constructor creates the clock and the
 * negotiation registers; systems are then added, and {@link #onReady()} builds the processor
 * pipeline, after which time can be advanced. The pipeline never changes afterwards.
 * <p>
 * A simulation is driven by one caller at a time; {@code advanceTime} calls must be serialized.
 */
public class Simulation implements IRegionProvider {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final SimulationSettings settings;
    private final GameClock clock;
    private final SubpulseLimit subpulseLimit = new SubpulseLimit();
    private final InterruptRegister interrupts = new InterruptRegister();
    private final EventLog eventLog = new EventLog();
    private final Map<UUID, StarSystem> systems = new LinkedHashMap<>();
    private PulseScheduler scheduler;

    /**
     * Constructs a new simulation with its clock at the configured start date.
     * @param settings The simulation settings.
     */
    public Simulation(SimulationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = new GameClock(settings.startDateTime());
    }

    /**
     * Builds the processor pipeline from the configured processor definitions.
     * @throws IllegalStateException if the simulation is already ready.
     */
    public void onReady() {
        onReady(ProcessorFactory.createAll(settings.processors()));
    }

    /**
     * Builds the processor pipeline from the given processors, in order.
     * @param processors The processors, in execution order.
     * @throws IllegalStateException if the simulation is already ready.
     */
    public void onReady(List<? extends ISubpulseProcessor> processors) {
        if (scheduler != null) {
            throw new IllegalStateException("Simulation '" + settings.name() + "' is already initialized");
        }
        ProcessorPipeline pipeline = new ProcessorPipeline(processors);
        this.scheduler = new PulseScheduler(this, clock, subpulseLimit, interrupts, pipeline, this,
                settings.minimumTimestep());
        LOG.info("Simulation '{}' ready at {}: systems={}, minimumTimestep={}s, pipeline={}",
                settings.name(), clock.now(), systems.size(), settings.minimumTimestep(), pipeline);
    }

    public boolean isReady() {
        return scheduler != null;
    }

    /**
     * Advances time by up to {@code seconds}.
     * @param seconds Requested time advance in seconds.
     * @return The pulse result.
     */
    public PulseResult advanceTime(long seconds) {
        return advanceTime(seconds, CancellationToken.NONE, null);
    }

    /**
     * Advances time by up to {@code seconds}, reporting progress after every subpulse.
     * @param seconds  Requested time advance in seconds.
     * @param progress Progress sink receiving fractions in [0, 1], may be {@code null}.
     * @return The pulse result.
     */
    public PulseResult advanceTime(long seconds, DoubleConsumer progress) {
        return advanceTime(seconds, CancellationToken.NONE, progress);
    }

    /**
     * Advances time by up to {@code seconds}. Interrupts and cancellation may stop the pulse
     * before the full request is advanced; the result says how much was committed.
     *
     * @param seconds           Requested time advance in seconds.
     * @param cancellationToken Cancellation token for this pulse.
     * @param progress          Progress sink receiving fractions in [0, 1], may be {@code null}.
     * @return The pulse result.
     * @throws IllegalStateException if {@link #onReady()} was not called, or if the clock has
     *                               reached the end of the supported date range.
     * @throws org.pulsar.runtime.pulse.ProcessorFaultException if a processor fails.
     */
    public PulseResult advanceTime(long seconds, CancellationToken cancellationToken, DoubleConsumer progress) {
        if (scheduler == null) {
            throw new IllegalStateException("Simulation '" + settings.name() + "' is not ready, call onReady() first");
        }
        PulseResult result = scheduler.advance(seconds, cancellationToken, progress);
        result.interruptIfAny().ifPresent(interrupt -> eventLog.add(new GameEvent(interrupt.raisedAt(),
                GameEvent.PULSE_INTERRUPTED, null, interrupt.reason())));
        return result;
    }

    /**
     * Adds a star system. Systems added between pulses take part in the next subpulse.
     * @param system The system to add.
     * @throws IllegalArgumentException if a system with the same id exists.
     * @throws IllegalStateException if the configured maximum number of systems is reached.
     */
    public void addSystem(StarSystem system) {
        Objects.requireNonNull(system, "system");
        if (systems.containsKey(system.getId())) {
            throw new IllegalArgumentException("System already present: " + system.getId());
        }
        if (settings.maxSystems() > 0 && systems.size() >= settings.maxSystems()) {
            throw new IllegalStateException("Maximum number of systems reached: " + settings.maxSystems());
        }
        systems.put(system.getId(), system);
    }

    /**
     * Removes a star system.
     * @param systemId The id of the system.
     * @return {@code true} if the system was present.
     */
    public boolean removeSystem(UUID systemId) {
        return systems.remove(systemId) != null;
    }

    public Optional<StarSystem> getSystem(UUID systemId) {
        return Optional.ofNullable(systems.get(systemId));
    }

    @Override
    public List<StarSystem> getActiveSystems() {
        return List.copyOf(systems.values());
    }

    public LocalDateTime getCurrentDateTime() {
        return clock.now();
    }

    /**
     * @return The interrupt left by the last pulse, if any.
     */
    public Optional<PulseInterrupt> getCurrentInterrupt() {
        return interrupts.current();
    }

    /**
     * Clears the interrupt left by the last pulse after the caller has handled it.
     */
    public void clearInterrupt() {
        interrupts.clear();
    }

    /**
     * The subpulse limit register. Callers may shorten it between pulses to bound the first
     * subpulse of the next pulse.
     * @return The subpulse limit.
     */
    public SubpulseLimit getSubpulseLimit() {
        return subpulseLimit;
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    public SimulationSettings getSettings() {
        return settings;
    }

    /**
     * @return The processor pipeline.
     * @throws IllegalStateException if {@link #onReady()} was not called.
     */
    public ProcessorPipeline getPipeline() {
        if (scheduler == null) {
            throw new IllegalStateException("Simulation '" + settings.name() + "' is not ready");
        }
        return scheduler.getPipeline();
    }
}
