package com.legacylens.core.model;

import java.util.Objects;

/**
 * Coarse resource usage estimate.
 *
 * @param memory estimate from the number of data items
 * @param cpu estimate from the number of procedures
 * @param ioIntensity estimate from file and database operations
 */
public record ResourceUsage(
    Rating memory,
    Rating cpu,
    Rating ioIntensity
) {
    public ResourceUsage {
        Objects.requireNonNull(memory, "memory must not be null");
        Objects.requireNonNull(cpu, "cpu must not be null");
        Objects.requireNonNull(ioIntensity, "ioIntensity must not be null");
    }

    public static ResourceUsage low() {
        return new ResourceUsage(Rating.LOW, Rating.LOW, Rating.LOW);
    }
}
