package org.pulsar.cli.commands;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pulsar.cli.CommandLineInterface;
import org.pulsar.junit.extensions.logging.LogWatchExtension;
import org.pulsar.node.config.LoggingConfigurator;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AdvanceCommandTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;
    private String configPath;

    @BeforeEach
    void setUp() throws URISyntaxException {
        ConfigFactory.invalidateCaches();
        LoggingConfigurator.reset();
        out = new StringWriter();
        err = new StringWriter();
        cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        configPath = Path.of(getClass().getClassLoader()
                .getResource("org/pulsar/node/config/two-systems.conf").toURI()).toString();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    void advance_printsOneLinePerPulseAndFinalClock() {
        int exitCode = cmd.execute("-c", configPath, "advance", "--seconds", "3600", "--pulses", "2");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("pulse 1: COMPLETED advanced=3600s subpulses=1 clock=2100-06-01T13:00")
                .contains("pulse 2: COMPLETED advanced=3600s")
                .contains("final clock: 2100-06-01T14:00");
    }

    @Test
    void advance_stopsAtFirstInterrupt() {
        int exitCode = cmd.execute("-c", configPath, "advance", "-s", "3600", "-n", "5");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("pulse 3: INTERRUPTED")
                .contains("interrupt=\"Courier arrived at Alpha I\"")
                .doesNotContain("pulse 4:");
    }

    @Test
    void advance_ignoreInterruptsKeepsPulsing() {
        int exitCode = cmd.execute("-c", configPath, "advance", "-s", "3600", "-n", "4", "--ignore-interrupts");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("pulse 3: INTERRUPTED")
                .contains("pulse 4: COMPLETED advanced=3600s");
    }

    @Test
    void advance_rejectsNonPositivePulseCount() {
        int exitCode = cmd.execute("-c", configPath, "advance", "-s", "60", "-n", "0");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--pulses must be >= 1");
    }

    @Test
    void advance_requiresSeconds() {
        int exitCode = cmd.execute("advance");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--seconds");
    }

    @Test
    void advance_missingConfigFileFails() {
        int exitCode = cmd.execute("-c", "/nonexistent/pulsar.conf", "advance", "-s", "60");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.SOFTWARE);
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
