package com.legacylens.core.model;

import java.util.Objects;

/**
 * A caller-to-callee edge between programs of a portfolio.
 *
 * @param source calling program id
 * @param target called dependency
 */
public record CallRelationship(
    String source,
    String target
) {
    public CallRelationship {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }
}
