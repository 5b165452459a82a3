package org.pulsar.runtime.pulse;

import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.model.GameClock;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.spi.IRegionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleConsumer;

/**
 * Advances the simulated clock of one simulation instance in subpulses.
 * <p>
 * Each pulse is split into subpulses whose length is the minimum of the remaining request and
 * the subpulse limit negotiated by the processors during the previous subpulse. For every
 * subpulse the clock is moved forward first and the whole processor pipeline then runs against
 * a fresh snapshot of the active systems. The loop stops when the request is used up, when a
 * processor raises an interrupt (after the pipeline pass that raised it), or when the caller
 * cancels (checked only at subpulse boundaries).
 * <p>
 * Strictly sequential; callers must serialize {@code advance} calls.
 */
public final class PulseScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(PulseScheduler.class);

    private final Simulation simulation;
    private final GameClock clock;
    private final SubpulseLimit subpulseLimit;
    private final InterruptRegister interrupts;
    private final ProcessorPipeline pipeline;
    private final IRegionProvider regionProvider;
    private final long minimumTimestep;

    public PulseScheduler(Simulation simulation,
                          GameClock clock,
                          SubpulseLimit subpulseLimit,
                          InterruptRegister interrupts,
                          ProcessorPipeline pipeline,
                          IRegionProvider regionProvider,
                          long minimumTimestep) {
        if (minimumTimestep < 1) {
            throw new IllegalArgumentException("minimumTimestep must be >= 1, got " + minimumTimestep);
        }
        this.simulation = simulation;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.subpulseLimit = Objects.requireNonNull(subpulseLimit, "subpulseLimit");
        this.interrupts = Objects.requireNonNull(interrupts, "interrupts");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.regionProvider = Objects.requireNonNull(regionProvider, "regionProvider");
        this.minimumTimestep = minimumTimestep;
    }

    /**
     * Rounds a request down to a multiple of the minimum timestep. A request that would round
     * to zero or below (including zero and negative requests) becomes exactly one timestep.
     *
     * @param requestedSeconds The requested duration.
     * @param minimumTimestep  The minimum timestep, must be >= 1.
     * @return The quantized duration, always a positive multiple of {@code minimumTimestep}.
     */
    public static long quantize(long requestedSeconds, long minimumTimestep) {
        if (requestedSeconds <= 0) {
            return minimumTimestep;
        }
        long quantized = requestedSeconds - requestedSeconds % minimumTimestep;
        return quantized == 0 ? minimumTimestep : quantized;
    }

    /**
     * Attempts to advance time by {@code requestedSeconds}. Interrupts and cancellation may stop
     * the pulse before the whole request is advanced.
     *
     * @param requestedSeconds  Time advance requested, in seconds.
     * @param cancellationToken Cancellation token for this pulse, {@code null} for none.
     * @param progress          Receives {@code advanced / quantizedRequest} after every
     *                          subpulse, may be {@code null}.
     * <p>
     * A request that would carry the clock past the largest representable date-time is cut
     * down to the last timestep that still fits.
     *
     * @return The pulse result, including the seconds actually advanced.
     * @throws IllegalStateException   if the clock cannot advance by even one timestep; nothing
     *                                 is changed in that case.
     * @throws ProcessorFaultException if a processor fails; already committed subpulses stay
     *                                 committed.
     */
    public PulseResult advance(long requestedSeconds, CancellationToken cancellationToken, DoubleConsumer progress) {
        CancellationToken cancellation = cancellationToken != null ? cancellationToken : CancellationToken.NONE;
        long quantized = quantize(requestedSeconds, minimumTimestep);
        if (quantized != requestedSeconds) {
            LOG.debug("Quantized pulse request from {}s to {}s (minimum timestep {}s)",
                    requestedSeconds, quantized, minimumTimestep);
        }
        long capacity = clock.secondsRemaining();
        if (quantized > capacity) {
            long representable = capacity - capacity % minimumTimestep;
            if (representable <= 0) {
                throw new IllegalStateException("Clock at " + clock.now() + " cannot advance by "
                        + minimumTimestep + "s without leaving the supported date range");
            }
            LOG.warn("Pulse request of {}s exceeds the supported date range, advancing at most {}s from {}",
                    quantized, representable, clock.now());
            quantized = representable;
        }

        long remaining = quantized;
        long advanced = 0;
        int subpulses = 0;

        interrupts.clear();
        while (!interrupts.isSet() && remaining > 0) {
            if (cancellation.isCancellationRequested()) {
                LOG.info("Pulse cancelled after {}s of {}s ({} subpulses), clock at {}",
                        advanced, quantized, subpulses, clock.now());
                return new PulseResult(requestedSeconds, quantized, advanced, subpulses, PulseOutcome.CANCELLED, null);
            }

            long subpulseSeconds = Math.min(subpulseLimit.read(), remaining);
            // Processors re-derive the next checkpoint from scratch during this subpulse.
            subpulseLimit.reset();

            LocalDateTime subpulseEnd = clock.advance(subpulseSeconds);
            List<StarSystem> systems = regionProvider.getActiveSystems();
            SubpulseContext context = new SubpulseContext(subpulses, subpulseSeconds, subpulseEnd, subpulseLimit, interrupts);
            try {
                pipeline.runAll(simulation, systems, subpulseSeconds, context);
            } catch (ProcessorFaultException e) {
                LOG.error("Pulse aborted at {}: processor '{}' failed in subpulse {} after {}s advanced",
                        subpulseEnd, e.getProcessorName(), e.getSubpulseIndex(), advanced);
                throw e;
            }

            subpulses++;
            remaining -= subpulseSeconds;
            advanced += subpulseSeconds;
            if (progress != null) {
                progress.accept((double) advanced / quantized);
            }
            LOG.debug("Subpulse {} advanced {}s across {} systems, clock at {}, next limit {}",
                    subpulses - 1, subpulseSeconds, systems.size(), subpulseEnd, subpulseLimit);
        }

        PulseInterrupt interrupt = interrupts.current().orElse(null);
        if (interrupt != null) {
            LOG.info("Pulse interrupted after {}s of {}s at {}: {}",
                    advanced, quantized, interrupt.raisedAt(), interrupt.reason());
            return new PulseResult(requestedSeconds, quantized, advanced, subpulses, PulseOutcome.INTERRUPTED, interrupt);
        }
        return new PulseResult(requestedSeconds, quantized, advanced, subpulses, PulseOutcome.COMPLETED, null);
    }

    public long getMinimumTimestep() {
        return minimumTimestep;
    }

    public ProcessorPipeline getPipeline() {
        return pipeline;
    }
}
