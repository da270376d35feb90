package com.tabletop.model;

/**
 * Represents where the turn state machine currently is.
 */
public enum TurnPhase {
    AWAITING_INTENT,    // Waiting for the current player to submit an intent
    RESOLVING,          // An intent is being applied
    MATCH_OVER          // Terminal: a win condition was met or the match was aborted
}
