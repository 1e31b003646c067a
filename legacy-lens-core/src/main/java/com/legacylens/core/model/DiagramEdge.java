package com.legacylens.core.model;

import java.util.Objects;

/**
 * A directed diagram edge.
 *
 * @param from source node id
 * @param to target node id
 * @param style visual class
 */
public record DiagramEdge(
    String from,
    String to,
    EdgeStyle style
) {
    public DiagramEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (style == null) {
            style = EdgeStyle.SOLID;
        }
    }

    public static DiagramEdge solid(String from, String to) {
        return new DiagramEdge(from, to, EdgeStyle.SOLID);
    }

    public static DiagramEdge dotted(String from, String to) {
        return new DiagramEdge(from, to, EdgeStyle.DOTTED);
    }
}
