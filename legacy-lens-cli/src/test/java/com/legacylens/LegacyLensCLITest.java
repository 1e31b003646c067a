package com.legacylens;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LegacyLensCLI} option handling.
 */
class LegacyLensCLITest {

    @Test
    void commandLine_version_printsVersion() {
        // Given
        CommandLine commandLine = LegacyLensCLI.commandLine();
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));

        // When
        int exitCode = commandLine.execute("--version");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("LegacyLens 1.0.0-SNAPSHOT");
    }

    @Test
    void commandLine_registersSubcommands() {
        CommandLine commandLine = LegacyLensCLI.commandLine();

        assertThat(commandLine.getSubcommands()).containsOnlyKeys("analyze", "portfolio", "list");
    }

    @Test
    void commandLine_globalOptions_areInheritedBySubcommands() {
        CommandLine commandLine = LegacyLensCLI.commandLine();

        CommandLine.ParseResult parseResult = commandLine.parseArgs("list", "-q", "sections");

        assertThat(parseResult.subcommand().hasMatchedOption("--quiet")).isTrue();
    }

    @Test
    void commandLine_unknownCommand_isUsageError() {
        CommandLine commandLine = LegacyLensCLI.commandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertThat(commandLine.execute("explode")).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
