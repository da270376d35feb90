package com.tabletop.model;

/**
 * Classification of a single board position.
 */
public enum SpaceType {
    START,
    GOAL,
    SPECIAL,
    NORMAL
}
