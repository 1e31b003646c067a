package com.legacylens.core.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds source files to analyze.
 *
 * <p>A path naming a regular file is always included. A directory is walked recursively and
 * contributes the regular files whose extension (case-insensitive) is in the configured list,
 * sorted by path. Missing paths and unreadable directories are logged and skipped.
 */
public class SourceDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SourceDiscovery.class);

    private final List<String> extensions;

    /**
     * Creates a discovery over the given extensions.
     *
     * @param extensions extensions with leading dot, e.g. {@code .cbl}
     */
    public SourceDiscovery(List<String> extensions) {
        Objects.requireNonNull(extensions, "extensions must not be null");
        this.extensions = extensions.stream()
            .map(extension -> extension.toLowerCase(Locale.ROOT))
            .toList();
    }

    /**
     * Resolves the given paths into source files.
     *
     * @param paths files or directories
     * @return distinct source files in discovery order
     */
    public List<Path> discover(List<Path> paths) {
        Set<Path> files = new LinkedHashSet<>();
        for (Path path : paths) {
            if (Files.isRegularFile(path)) {
                files.add(path);
            } else if (Files.isDirectory(path)) {
                files.addAll(walk(path));
            } else {
                log.warn("Source path not found: {}", path);
            }
        }
        log.debug("Discovered {} source files", files.size());
        return new ArrayList<>(files);
    }

    /**
     * Checks whether a file name carries one of the configured extensions.
     *
     * @param file file path
     * @return true if the extension matches
     */
    public boolean matches(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    private List<Path> walk(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(this::matches)
                .sorted()
                .toList();
        } catch (IOException e) {
            log.warn("Failed to walk directory {}: {}", directory, e.getMessage());
            return List.of();
        }
    }
}
