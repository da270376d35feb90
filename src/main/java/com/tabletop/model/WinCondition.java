package com.tabletop.model;

/**
 * Win condition determines how a match ends besides the last player standing.
 */
public enum WinCondition {
    ELIMINATION,        // Last active player wins
    BALANCE_THRESHOLD,  // First active player whose balance reaches the threshold wins
    REACH_GOAL          // First player to reach or cross the goal space wins
}
