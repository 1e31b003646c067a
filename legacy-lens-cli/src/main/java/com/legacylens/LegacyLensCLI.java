package com.legacylens;

import com.legacylens.cli.AnalyzeCommand;
import com.legacylens.cli.ListCommand;
import com.legacylens.cli.PortfolioCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for LegacyLens.
 *
 * <p>LegacyLens analyzes COBOL-style sources and produces structural models, quality metrics,
 * recommendations, narrative reports and Mermaid diagrams.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze sources and write per-program output</li>
 *   <li>{@code portfolio} - Summarize many programs at once</li>
 *   <li>{@code list} - List available generators, renderers or report sections</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Analyze a directory of sources
 * legacylens analyze src/cobol
 *
 * # Summarize a portfolio and keep the JSON
 * legacylens portfolio src/cobol --json
 *
 * # List available generators
 * legacylens list generators
 * }</pre>
 */
@Command(
    name = "legacylens",
    mixinStandardHelpOptions = true,
    version = "LegacyLens 1.0.0-SNAPSHOT",
    description = "Static analysis and documentation for legacy COBOL sources",
    subcommands = {
        AnalyzeCommand.class,
        PortfolioCommand.class,
        ListCommand.class
    }
)
public class LegacyLensCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LegacyLensCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)", scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors", scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("LegacyLens - Legacy Source Analysis");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'legacylens --help' to see available commands");
        System.out.println("Use 'legacylens <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        LegacyLensCLI cli = new LegacyLensCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
