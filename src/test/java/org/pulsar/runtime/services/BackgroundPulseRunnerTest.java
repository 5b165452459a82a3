package org.pulsar.runtime.services;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pulsar.junit.extensions.logging.ExpectLog;
import org.pulsar.junit.extensions.logging.LogLevel;
import org.pulsar.junit.extensions.logging.LogWatchExtension;
import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.SimulationSettings;
import org.pulsar.runtime.model.StarSystem;
import org.pulsar.runtime.pulse.ProcessorFaultException;
import org.pulsar.runtime.pulse.PulseOutcome;
import org.pulsar.runtime.pulse.PulseResult;
import org.pulsar.runtime.pulse.SubpulseContext;
import org.pulsar.runtime.spi.ISubpulseProcessor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class BackgroundPulseRunnerTest {

    private Simulation simulation;
    private GateProcessor gate;
    private BackgroundPulseRunner runner;

    /**
     * Works in 5 second subpulses and blocks in subpulse 1 until released.
     */
    private static final class GateProcessor implements ISubpulseProcessor {
        final CountDownLatch reachedGate = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean fail;

        @Override
        public void process(Simulation simulation, List<StarSystem> systems, long deltaSeconds, SubpulseContext context) {
            context.requestSubpulseLimit(5);
            if (context.getSubpulseIndex() == 1) {
                reachedGate.countDown();
                try {
                    if (!release.await(5, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("Gate was never released");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                if (fail) {
                    throw new IllegalStateException("Gate failure");
                }
            }
        }
    }

    @BeforeEach
    void setUp() {
        simulation = new Simulation(SimulationSettings.defaults("Background"));
        gate = new GateProcessor();
        simulation.onReady(List.of(gate));
        simulation.getSubpulseLimit().request(5);
        runner = new BackgroundPulseRunner(simulation);
    }

    @AfterEach
    void tearDown() {
        gate.release.countDown();
        runner.close();
    }

    @Test
    void submit_runsPulseOnWorkerThreadAndReportsProgress() throws Exception {
        List<Double> progress = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        gate.release.countDown();

        PulseResult result = runner.submit(20, fraction -> {
            progress.add(fraction);
            threads.add(Thread.currentThread().getName());
        }).get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo(PulseOutcome.COMPLETED);
        assertThat(result.secondsAdvanced()).isEqualTo(20);
        assertThat(progress).containsExactly(0.25, 0.5, 0.75, 1.0);
        assertThat(threads).containsOnly("pulse-runner");
        assertThat(runner.isBusy()).isFalse();
        assertThat(runner.getProgressPercent()).isZero();
    }

    @Test
    void submit_rejectsSecondPulseWhileBusy() throws Exception {
        CompletableFuture<PulseResult> first = runner.submit(50);
        assertThat(gate.reachedGate.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(runner.isBusy()).isTrue();
        assertThatThrownBy(() -> runner.submit(10))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already running");

        gate.release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).secondsAdvanced()).isEqualTo(50);
        await().atMost(Duration.ofSeconds(5)).until(() -> !runner.isBusy());
        assertThat(runner.submit(10).get(5, TimeUnit.SECONDS).isCompleted()).isTrue();
    }

    @Test
    void getProgressPercent_reflectsCommittedSubpulses() throws Exception {
        CompletableFuture<PulseResult> future = runner.submit(50);
        assertThat(gate.reachedGate.await(5, TimeUnit.SECONDS)).isTrue();

        await().atMost(Duration.ofSeconds(5)).until(() -> runner.getProgressPercent() == 10.0);

        gate.release.countDown();
        future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void cancel_stopsPulseAtNextSubpulseBoundary() throws Exception {
        assertThat(runner.cancel()).isFalse();
        CompletableFuture<PulseResult> future = runner.submit(50);
        assertThat(gate.reachedGate.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(runner.cancel()).isTrue();
        gate.release.countDown();

        PulseResult result = future.get(5, TimeUnit.SECONDS);
        assertThat(result.isCancelled()).isTrue();
        assertThat(result.secondsAdvanced()).isEqualTo(10);
        assertThat(simulation.getCurrentDateTime()).isEqualTo(simulation.getSettings().startDateTime().plusSeconds(10));
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*PulseScheduler", messagePattern = "Pulse aborted.*")
    void submit_processorFaultCompletesFutureExceptionally() throws Exception {
        gate.fail = true;
        CompletableFuture<PulseResult> future = runner.submit(50);
        gate.release.countDown();

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ProcessorFaultException.class);
        await().atMost(Duration.ofSeconds(5)).until(() -> !runner.isBusy());
    }

    @Test
    void submit_afterCloseIsRejected() {
        runner.close();

        assertThatThrownBy(() -> runner.submit(10))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
        assertThat(runner.isBusy()).isFalse();
    }
}
