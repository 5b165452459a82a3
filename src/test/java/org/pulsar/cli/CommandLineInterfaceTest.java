package org.pulsar.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CommandLineInterfaceTest {

    @Test
    void version_printsProductVersion() {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Pulsar 1.0");
    }

    @Test
    void help_listsAdvanceSubcommand() {
        StringWriter out = new StringWriter();
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("advance").contains("--config");
    }

    @Test
    void unknownOption_isUsageError() {
        StringWriter err = new StringWriter();
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setErr(new PrintWriter(err));

        int exitCode = cmd.execute("--bogus");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--bogus");
    }
}
