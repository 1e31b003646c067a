package com.legacylens.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.config.AnalyzerConfig;
import com.legacylens.core.engine.SourceAnalysisEngine;
import com.legacylens.core.export.AnalysisOutputAssembler;
import com.legacylens.core.generator.DiagramGenerator;
import com.legacylens.core.model.AnalysisResult;
import com.legacylens.core.renderer.GeneratedOutput;
import com.legacylens.core.renderer.OutputRenderer;
import com.legacylens.core.renderer.RenderContext;
import com.legacylens.core.renderer.impl.FileSystemRenderer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to analyze sources and write per-program output.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Discover and read source files</li>
 *   <li>Analyze each source</li>
 *   <li>Assemble JSON, Markdown and diagram files per program</li>
 *   <li>Render output to the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze a single program
 * legacylens analyze PAYROLL.cbl
 *
 * # Analyze a directory, JSON only
 * legacylens analyze src/cobol --format json -o build/legacy
 *
 * # Print everything to the console instead of writing files
 * legacylens analyze PAYROLL.cbl --renderer console
 *
 * # Dry run (analysis only, no files written)
 * legacylens analyze src/cobol --dry-run
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze sources and write reports, metrics and diagrams",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

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
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--format"},
        split = ",",
        description = "Output formats: json, markdown, mermaid (overrides config)"
    )
    private List<String> formats;

    @Option(
        names = {"--renderer"},
        description = "Output renderer: filesystem or console (default: filesystem)"
    )
    private String rendererId = "filesystem";

    @Option(
        names = {"--dry-run"},
        description = "Analyze sources but don't write output"
    )
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            AnalyzerConfig config = SourceBatch.loadConfig(configPath);

            if (dryRun) {
                System.out.println("Running in dry-run mode (no output will be generated)");
                System.out.println();
            }

            SourceBatch batch = SourceBatch.analyze(paths, config, new SourceAnalysisEngine());
            List<AnalysisResult> results = batch.results();
            if (batch.discovered() == 0) {
                System.err.println("✗ No source files found in: " + paths);
                return 1;
            }
            System.out.println("✓ Analyzed " + results.size() + " of " + batch.discovered() + " source files");

            results.forEach(this::printResultSummary);

            if (results.isEmpty()) {
                return 1;
            }

            if (dryRun) {
                System.out.println();
                System.out.println("Dry-run mode: Skipping output rendering");
                return 0;
            }

            GeneratedOutput output = assembleOutput(results, selectedFormats(config));
            System.out.println("✓ Created " + output.files().size() + " output files");

            Path outputDirectory = outputDirectory(config);
            renderOutput(output, outputDirectory, config);
            System.out.println("✓ Rendered output with " + rendererId + " to: " + outputDirectory.toAbsolutePath());

            System.out.println();
            System.out.println("✓ Analysis complete");

            return batch.failures() == 0 ? 0 : 1;

        } catch (Exception e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private void printResultSummary(AnalysisResult result) {
        System.out.printf(Locale.ROOT, "  → %s (%s): quality %.2f, complexity %s, %d recommendations%n",
            result.programId(),
            result.sourceName(),
            result.metrics().qualityScore(),
            result.metrics().complexity().rating().label(),
            result.recommendations().size());
        if (result.model().isDegraded()) {
            System.out.println("    ⚠ Structural extraction incomplete: " + result.model().error());
        }
    }

    private List<String> selectedFormats(AnalyzerConfig config) {
        if (formats != null && !formats.isEmpty()) {
            return formats;
        }
        return config.output().formats();
    }

    private Path outputDirectory(AnalyzerConfig config) {
        if (outputDir != null) {
            return outputDir;
        }
        return Path.of(config.output().directory());
    }

    /**
     * Assembles the files of every result, each under its own directory.
     */
    private GeneratedOutput assembleOutput(List<AnalysisResult> results, List<String> selectedFormats) {
        List<DiagramGenerator> generators = new ArrayList<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(generators::add);
        log.debug("Discovered {} diagram generators", generators.size());

        AnalysisOutputAssembler assembler = new AnalysisOutputAssembler(generators);
        Set<String> usedDirectories = new HashSet<>();
        GeneratedOutput output = GeneratedOutput.empty();

        for (AnalysisResult result : results) {
            String directory = uniqueDirectory(AnalysisOutputAssembler.directoryName(result.sourceName()), usedDirectories);
            output = output.plus(assembler.assemble(result, directory, selectedFormats));
        }
        return output;
    }

    private static String uniqueDirectory(String base, Set<String> usedDirectories) {
        String candidate = base;
        int suffix = 2;
        while (!usedDirectories.add(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    private void renderOutput(GeneratedOutput output, Path outputDirectory, AnalyzerConfig config) {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);

        OutputRenderer renderer = renderers.stream()
            .filter(r -> r.getId().equals(rendererId))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Output renderer not found: " + rendererId));

        log.info("Rendering output with: {}", renderer.getId());
        renderer.render(output, new RenderContext(outputDirectory,
            Map.of(FileSystemRenderer.ENCODING_SETTING, config.output().encoding())));
    }
}
