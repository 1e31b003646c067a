package com.legacylens.core.model;

import java.util.Objects;

/**
 * A diagram node.
 *
 * @param id node identifier, unique within its diagram
 * @param label display label
 * @param role node role
 */
public record DiagramNode(
    String id,
    String label,
    NodeRole role
) {
    public DiagramNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }
}
