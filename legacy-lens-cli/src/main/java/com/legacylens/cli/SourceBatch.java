package com.legacylens.cli;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.config.AnalyzerConfig;
import com.legacylens.core.config.ConfigLoader;
import com.legacylens.core.engine.SourceAnalysisEngine;
import com.legacylens.core.model.AnalysisResult;
import com.legacylens.core.model.SourceUnit;
import com.legacylens.core.source.SourceDiscovery;
import com.legacylens.core.source.SourceReader;

/**
 * Discovers, reads and analyzes the sources named on the command line.
 *
 * <p>Files that cannot be read are logged and counted; they never stop the batch.
 */
final class SourceBatch {

    private static final Logger log = LoggerFactory.getLogger(SourceBatch.class);

    static final Path DEFAULT_CONFIG = Path.of("legacylens.yaml");

    private final List<AnalysisResult> results;
    private final int discovered;
    private final int failures;

    private SourceBatch(List<AnalysisResult> results, int discovered, int failures) {
        this.results = List.copyOf(results);
        this.discovered = discovered;
        this.failures = failures;
    }

    /**
     * Loads the configuration, using defaults silently when the default file is absent.
     *
     * @param configPath configured path, or null for {@code legacylens.yaml}
     * @return configuration
     */
    static AnalyzerConfig loadConfig(Path configPath) {
        if (configPath == null) {
            if (!Files.exists(DEFAULT_CONFIG)) {
                log.debug("No {} found, using defaults", DEFAULT_CONFIG);
                return AnalyzerConfig.defaults();
            }
            return ConfigLoader.load(DEFAULT_CONFIG);
        }
        return ConfigLoader.load(configPath);
    }

    /**
     * Analyzes every source found under the given paths.
     *
     * @param paths files or directories
     * @param config configuration
     * @param engine analysis engine
     * @return batch outcome
     */
    static SourceBatch analyze(List<Path> paths, AnalyzerConfig config, SourceAnalysisEngine engine) {
        SourceDiscovery discovery = new SourceDiscovery(config.source().extensions());
        SourceReader reader = new SourceReader(Charset.forName(config.source().encoding()));

        List<Path> files = discovery.discover(paths);
        List<AnalysisResult> results = new ArrayList<>();
        int failures = 0;

        for (Path file : files) {
            SourceUnit unit;
            try {
                unit = reader.read(file);
            } catch (IOException e) {
                log.warn("Failed to read {}: {}", file, e.getMessage());
                System.err.println("✗ Failed to read " + file + ": " + e.getMessage());
                failures++;
                continue;
            }
            results.add(engine.analyze(unit));
        }

        return new SourceBatch(results, files.size(), failures);
    }

    List<AnalysisResult> results() {
        return results;
    }

    int discovered() {
        return discovered;
    }

    int failures() {
        return failures;
    }
}
