package org.pulsar.runtime.services;

import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.pulse.CancellationToken;
import org.pulsar.runtime.pulse.PulseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleConsumer;

/**
 * Runs pulses of one simulation on a dedicated worker thread so the caller's foreground thread
 * stays free.
 * <p>
 * Only one pulse may be in flight at a time, which keeps {@code advanceTime} calls serialized.
 * The in-flight pulse can be cancelled; cancellation takes effect at the next subpulse boundary.
 */
public final class BackgroundPulseRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BackgroundPulseRunner.class);

    private final Simulation simulation;
    private final ExecutorService executor;
    private final AtomicReference<CancellationToken> inFlight = new AtomicReference<>();
    private volatile double progressPercent = 0.0;

    public BackgroundPulseRunner(Simulation simulation) {
        this.simulation = Objects.requireNonNull(simulation, "simulation");
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pulse-runner");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts a pulse in the background.
     * @param seconds Requested time advance in seconds.
     * @return A future completed with the pulse result, or exceptionally if a processor fails.
     * @throws IllegalStateException if a pulse is already running or the runner is closed.
     */
    public CompletableFuture<PulseResult> submit(long seconds) {
        return submit(seconds, null);
    }

    /**
     * Starts a pulse in the background.
     * @param seconds          Requested time advance in seconds.
     * @param progressListener Receives progress fractions on the worker thread, may be {@code null}.
     * @return A future completed with the pulse result, or exceptionally if a processor fails.
     * @throws IllegalStateException if a pulse is already running or the runner is closed.
     */
    public CompletableFuture<PulseResult> submit(long seconds, DoubleConsumer progressListener) {
        CancellationToken token = new CancellationToken();
        if (!inFlight.compareAndSet(null, token)) {
            throw new IllegalStateException("A pulse is already running");
        }
        try {
            return CompletableFuture.supplyAsync(() -> runPulse(seconds, token, progressListener), executor);
        } catch (RejectedExecutionException e) {
            inFlight.set(null);
            throw new IllegalStateException("Pulse runner is closed", e);
        }
    }

    private PulseResult runPulse(long seconds, CancellationToken token, DoubleConsumer progressListener) {
        try {
            LOG.debug("Background pulse of {}s started", seconds);
            return simulation.advanceTime(seconds, token, fraction -> {
                progressPercent = fraction * 100.0;
                if (progressListener != null) {
                    progressListener.accept(fraction);
                }
            });
        } finally {
            progressPercent = 0.0;
            inFlight.set(null);
        }
    }

    /**
     * Requests cancellation of the in-flight pulse.
     * @return {@code true} if a pulse was running.
     */
    public boolean cancel() {
        CancellationToken token = inFlight.get();
        if (token == null) {
            return false;
        }
        token.cancel();
        LOG.info("Cancellation requested for the running pulse");
        return true;
    }

    public boolean isBusy() {
        return inFlight.get() != null;
    }

    /**
     * @return Progress of the running pulse in percent, 0 when idle.
     */
    public double getProgressPercent() {
        return progressPercent;
    }

    /**
     * Cancels any running pulse and stops the worker thread.
     */
    @Override
    public void close() {
        cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Pulse runner did not stop within 5 seconds, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
