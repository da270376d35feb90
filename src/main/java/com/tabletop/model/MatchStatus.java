package com.tabletop.model;

/**
 * Lifecycle status of a match.
 */
public enum MatchStatus {
    IN_PROGRESS,
    FINISHED,
    ABORTED
}
