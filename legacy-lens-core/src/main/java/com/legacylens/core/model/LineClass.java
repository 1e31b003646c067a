package com.legacylens.core.model;

/**
 * Classification of a normalized source line.
 */
public enum LineClass {
    BLANK,
    COMMENT,
    CODE
}
