package com.legacylens.core.model;

/**
 * Role of a node inside a diagram. Renderers pick shapes from it.
 */
public enum NodeRole {
    TERMINAL,
    PROCEDURE,
    HUB,
    DATA_ITEM,
    DEPENDENCY,
    COPYBOOK
}
