package com.tabletop.exception;

/**
 * Typed reason an intent was rejected. The match is unchanged and continues.
 */
public enum RejectionReason {
    OUT_OF_TURN,
    UNKNOWN_PLAYER,
    MATCH_OVER,
    FEATURE_DISABLED,
    INVALID_TARGET,
    INVALID_INTENT,
    INSUFFICIENT_FUNDS
}
