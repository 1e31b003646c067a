package com.legacylens.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural facts extracted from one source unit.
 *
 * <p>Built once per analysis and never modified. Dependency sets keep first-seen order so
 * serialized output is stable across runs.
 *
 * <p>A model with a non-null {@link #error()} is <em>degraded</em>: extraction hit an internal
 * fault, so every collection is empty and the program id is {@link #UNKNOWN_PROGRAM}. Line
 * statistics are still populated and downstream stages run normally.
 *
 * @param programId program identity, {@link #UNKNOWN_PROGRAM} when no marker was found
 * @param divisions division headers in order of appearance
 * @param procedures paragraph labels and invoked targets in order of appearance
 * @param dataItems working-storage declarations
 * @param fileDescriptors file section entries
 * @param dependencies external call targets; variable targets carry the {@link #DYNAMIC_PREFIX}
 * @param copyDependencies copybook names
 * @param lineStats line counts
 * @param estimatedComplexity coarse complexity seed
 * @param error failure description for degraded models, null otherwise
 */
public record StructuralModel(
    String programId,
    List<Division> divisions,
    List<Procedure> procedures,
    List<DataItem> dataItems,
    List<FileDescriptor> fileDescriptors,
    Set<String> dependencies,
    Set<String> copyDependencies,
    LineStats lineStats,
    Rating estimatedComplexity,
    String error
) {
    public static final String UNKNOWN_PROGRAM = "UNKNOWN";
    public static final String DYNAMIC_PREFIX = "DYNAMIC:";

    /**
     * Compact constructor with validation.
     */
    public StructuralModel {
        if (programId == null || programId.isBlank()) {
            programId = UNKNOWN_PROGRAM;
        }
        divisions = divisions == null ? List.of() : List.copyOf(divisions);
        procedures = procedures == null ? List.of() : List.copyOf(procedures);
        dataItems = dataItems == null ? List.of() : List.copyOf(dataItems);
        fileDescriptors = fileDescriptors == null ? List.of() : List.copyOf(fileDescriptors);
        dependencies = orderedCopy(dependencies);
        copyDependencies = orderedCopy(copyDependencies);
        Objects.requireNonNull(lineStats, "lineStats must not be null");
        if (estimatedComplexity == null) {
            estimatedComplexity = Rating.LOW;
        }
    }

    /**
     * Creates a degraded model that carries only line statistics and the failure description.
     *
     * @param error failure description
     * @param lineStats line statistics computed before the failure
     * @return degraded model
     */
    public static StructuralModel degraded(String error, LineStats lineStats) {
        Objects.requireNonNull(error, "error must not be null");
        return new StructuralModel(UNKNOWN_PROGRAM, List.of(), List.of(), List.of(), List.of(),
            Set.of(), Set.of(), lineStats, Rating.LOW, error);
    }

    public boolean isDegraded() {
        return error != null;
    }

    /**
     * Returns the dependencies referenced through a variable rather than a literal.
     *
     * @return dynamic dependencies, prefix included
     */
    public List<String> dynamicDependencies() {
        return dependencies.stream()
            .filter(dependency -> dependency.startsWith(DYNAMIC_PREFIX))
            .toList();
    }

    private static Set<String> orderedCopy(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
