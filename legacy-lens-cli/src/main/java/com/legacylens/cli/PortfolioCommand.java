package com.legacylens.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.config.AnalyzerConfig;
import com.legacylens.core.engine.SourceAnalysisEngine;
import com.legacylens.core.export.JsonExporter;
import com.legacylens.core.model.CallRelationship;
import com.legacylens.core.model.DependencyUsage;
import com.legacylens.core.model.PortfolioSummary;
import com.legacylens.core.model.Rating;
import com.legacylens.core.portfolio.PortfolioAnalyzer;
import com.legacylens.core.renderer.GeneratedFile;
import com.legacylens.core.renderer.GeneratedOutput;
import com.legacylens.core.renderer.RenderContext;
import com.legacylens.core.renderer.impl.FileSystemRenderer;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to summarize a portfolio of programs.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * legacylens portfolio src/cobol
 * legacylens portfolio src/cobol --json -o build/legacy
 * }</pre>
 */
@Command(
    name = "portfolio",
    description = "Summarize complexity, dependencies and quality across many programs",
    mixinStandardHelpOptions = true
)
public class PortfolioCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PortfolioCommand.class);

    static final String PORTFOLIO_FILE = "portfolio.json";

    @Parameters(
        arity = "1..*",
        description = "Source files or directories"
    )
    private List<Path> paths;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: legacylens.yaml)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory for portfolio.json (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--json"},
        description = "Also write " + PORTFOLIO_FILE
    )
    private boolean writeJson;

    @Override
    public Integer call() {
        try {
            AnalyzerConfig config = SourceBatch.loadConfig(configPath);
            SourceBatch batch = SourceBatch.analyze(paths, config, new SourceAnalysisEngine());
            if (batch.discovered() == 0) {
                System.err.println("✗ No source files found in: " + paths);
                return 1;
            }

            PortfolioSummary summary = new PortfolioAnalyzer().summarize(batch.results());
            printSummary(config, summary);

            if (writeJson) {
                Path directory = outputDir != null ? outputDir : Path.of(config.output().directory());
                GeneratedOutput output = new GeneratedOutput(List.of(
                    new GeneratedFile(PORTFOLIO_FILE, new JsonExporter().toJson(summary), "application/json")));
                new FileSystemRenderer().render(output, new RenderContext(directory,
                    Map.of(FileSystemRenderer.ENCODING_SETTING, config.output().encoding())));
                System.out.println("✓ Wrote " + directory.resolve(PORTFOLIO_FILE).toAbsolutePath());
            }

            return batch.failures() == 0 ? 0 : 1;

        } catch (Exception e) {
            log.error("Portfolio analysis failed", e);
            System.err.println("✗ Portfolio analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(AnalyzerConfig config, PortfolioSummary summary) {
        System.out.println("Portfolio: " + config.project().name());
        System.out.println("  Programs: " + summary.programCount());
        System.out.println("  Total lines: " + summary.totalLines());
        System.out.println(String.format(Locale.ROOT, "  Average quality score: %.2f", summary.averageQualityScore()));
        System.out.println("  Complexity:");
        for (Rating rating : Rating.values()) {
            System.out.printf("    %-6s %d%n", rating.label(), summary.complexityBreakdown().get(rating));
        }

        if (!summary.commonDependencies().isEmpty()) {
            System.out.println("  Common dependencies:");
            for (DependencyUsage usage : summary.commonDependencies()) {
                System.out.printf("    • %s (%d)%n", usage.name(), usage.count());
            }
        }

        if (!summary.callRelationships().isEmpty()) {
            System.out.println("  Call relationships:");
            for (CallRelationship call : summary.callRelationships()) {
                System.out.println("    " + call.source() + " → " + call.target());
            }
        }

        if (!summary.degradedPrograms().isEmpty()) {
            System.out.println("  ⚠ Degraded: " + String.join(", ", summary.degradedPrograms()));
        }
    }
}
