package com.legacylens.core.model;

/**
 * Kinds of diagrams synthesized for a program.
 */
public enum DiagramKind {
    FLOW("flow", "Program Flow"),
    DATA("data", "Data Structure"),
    DEPENDENCY("dependency", "Dependencies");

    private final String id;
    private final String title;

    DiagramKind(String id, String title) {
        this.id = id;
        this.title = title;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }
}
