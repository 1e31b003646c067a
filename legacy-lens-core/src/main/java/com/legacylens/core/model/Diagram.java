package com.legacylens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A graph-shaped diagram value. Rendering into a concrete markup is left to
 * {@code DiagramGenerator} implementations.
 *
 * @param kind diagram kind
 * @param nodes nodes in insertion order
 * @param edges edges in insertion order
 */
public record Diagram(
    DiagramKind kind,
    List<DiagramNode> nodes,
    List<DiagramEdge> edges
) {
    public Diagram {
        Objects.requireNonNull(kind, "kind must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Counts the nodes with the given role.
     *
     * @param role node role
     * @return number of nodes with that role
     */
    public long countNodes(NodeRole role) {
        return nodes.stream().filter(node -> node.role() == role).count();
    }
}
