package com.tabletop.model;

/**
 * Gameplay subsystems a match can be composed of, in construction order.
 */
public enum ModuleType {
    BOARD,
    CURRENCY,
    PROPERTY,
    COMBAT,
    MOVEMENT
}
