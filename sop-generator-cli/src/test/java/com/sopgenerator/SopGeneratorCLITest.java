package com.sopgenerator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class SopGeneratorCLITest {

    @Test
    @DisplayName("Should register every subcommand")
    void commandLine_registersSubcommands() {
        CommandLine commandLine = SopGeneratorCLI.commandLine();

        assertThat(commandLine.getSubcommands())
            .containsOnlyKeys("generate", "extract", "outline", "validate", "template");
    }

    @Test
    @DisplayName("Should reject an unknown subcommand")
    void execute_unknownCommand_returnsUsageError() {
        CommandLine commandLine = SopGeneratorCLI.commandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("publish");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    @DisplayName("Should print the version")
    void execute_version_printsVersion() {
        CommandLine commandLine = SopGeneratorCLI.commandLine();
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("SOP Generator 1.0.0-SNAPSHOT");
    }
}
