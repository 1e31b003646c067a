package com.legacylens.core.model;

/**
 * Control-flow density of a program, from the number of conditionals.
 */
public enum FlowComplexity {
    SIMPLE,
    MODERATE,
    COMPLEX
}
