package com.tabletop.module;

/**
 * Outcome of a single position update.
 */
public record MoveResult(int playerId, int from, int to, int spaces, boolean passedStart) {}
