package com.tabletop.model;

/**
 * Game shape detected from a rule configuration.
 */
public enum Archetype {
    TRADING,        // Shared loop board with currency and purchasable properties
    GRID_COMBAT,    // Separate grid boards with ship placement and combat
    RACE,           // Movement and dice only
    HYBRID          // Several feature families at once, or an inconsistent configuration
}
