package com.legacylens.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Files produced by one command run.
 *
 * @param files generated files in write order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput empty() {
        return new GeneratedOutput(List.of());
    }

    /**
     * Returns a new output holding this output's files followed by the other's.
     *
     * @param other output to append
     * @return combined output
     */
    public GeneratedOutput plus(GeneratedOutput other) {
        List<GeneratedFile> combined = new ArrayList<>(files);
        combined.addAll(other.files());
        return new GeneratedOutput(combined);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
