package org.pulsar.cli.commands;

import com.typesafe.config.Config;
import org.pulsar.cli.CommandLineInterface;
import org.pulsar.runtime.Simulation;
import org.pulsar.runtime.model.GameEvent;
import org.pulsar.runtime.pulse.PulseResult;
import org.pulsar.runtime.setup.SimulationBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "advance",
    description = "Boots a simulation from the configuration and advances its clock."
)
public class AdvanceCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdvanceCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-s", "--seconds"}, required = true, description = "Seconds to request per pulse.")
    private long seconds;

    @Option(names = {"-n", "--pulses"}, defaultValue = "1", description = "Number of pulses to run (default: ${DEFAULT-VALUE}).")
    private int pulses;

    @Option(names = "--ignore-interrupts", description = "Clear interrupts and keep pulsing instead of stopping.")
    private boolean ignoreInterrupts;

    @Override
    public Integer call() {
        if (pulses < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--pulses must be >= 1, got " + pulses);
        }
        final Config config = parent.getConfig();
        final Simulation simulation = SimulationBootstrap.fromConfig(config);
        final PrintWriter out = spec.commandLine().getOut();

        LOGGER.info("Running {} pulse(s) of {}s starting at {}", pulses, seconds, simulation.getCurrentDateTime());
        for (int pulse = 1; pulse <= pulses; pulse++) {
            final PulseResult result = simulation.advanceTime(seconds);
            out.printf("pulse %d: %s advanced=%ds subpulses=%d clock=%s%s%n",
                    pulse,
                    result.outcome(),
                    result.secondsAdvanced(),
                    result.subpulseCount(),
                    simulation.getCurrentDateTime(),
                    result.interruptIfAny().map(i -> " interrupt=\"" + i.reason() + "\"").orElse(""));
            for (GameEvent event : simulation.getEventLog().drain()) {
                LOGGER.debug("{} {} {}", event.dateTime(), event.type(), event.message());
            }

            if (result.isInterrupted()) {
                if (!ignoreInterrupts) {
                    break;
                }
                simulation.clearInterrupt();
            }
        }
        out.printf("final clock: %s%n", simulation.getCurrentDateTime());
        out.flush();
        return 0;
    }
}
