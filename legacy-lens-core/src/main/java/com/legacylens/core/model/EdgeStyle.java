package com.legacylens.core.model;

/**
 * Visual class of a diagram edge.
 */
public enum EdgeStyle {
    SOLID,
    DOTTED
}
