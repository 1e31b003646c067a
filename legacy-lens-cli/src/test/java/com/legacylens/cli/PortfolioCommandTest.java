package com.legacylens.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PortfolioCommand}.
 */
class PortfolioCommandTest {

    @TempDir
    Path tempDir;

    private CliTestSupport console;
    private Path sources;

    @BeforeEach
    void setUp() throws IOException {
        console = new CliTestSupport();
        sources = tempDir.resolve("src");
        CliTestSupport.write(sources.resolve("PAYROLL.cbl"), CliTestSupport.PAYROLL);
        CliTestSupport.write(sources.resolve("BILLING.cob"), CliTestSupport.BILLING);
    }

    @AfterEach
    void tearDown() {
        console.close();
    }

    @Test
    void portfolio_printsSummary() {
        // When
        int exitCode = new CommandLine(new PortfolioCommand()).execute(sources.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(console.out())
            .contains("Portfolio: legacy-estate")
            .contains("Programs: 2")
            .contains("Total lines: 14")
            .contains("• SUBPGM (2)")
            .contains("PAYROLL → SUBPGM")
            .contains("BILLING → DATEUTIL")
            .doesNotContain("→ DYNAMIC:");
    }

    @Test
    void portfolio_json_writesPortfolioFile() throws IOException {
        Path output = tempDir.resolve("out");

        int exitCode = new CommandLine(new PortfolioCommand())
            .execute(sources.toString(), "--json", "-o", output.toString());

        assertThat(exitCode).isZero();
        Path json = output.resolve(PortfolioCommand.PORTFOLIO_FILE);
        assertThat(json).isRegularFile();
        assertThat(Files.readString(json))
            .contains("\"program_count\" : 2")
            .contains("\"common_dependencies\"");
    }

    @Test
    void portfolio_missingPath_fails() {
        int exitCode = new CommandLine(new PortfolioCommand()).execute(tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
