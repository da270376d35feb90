package com.tabletop.service;

import com.tabletop.event.MatchEvent;

import java.util.List;

/**
 * Outcome of a successfully resolved intent.
 *
 * @param events          every event the intent produced, in the order they happened
 * @param turnEnded       whether the turn passed to another player (or back to the same one on a new round)
 * @param matchOver       whether the intent ended the match
 * @param currentPlayerId the player whose turn it is after resolution
 */
public record IntentResult(List<MatchEvent> events, boolean turnEnded, boolean matchOver, int currentPlayerId) {

    public IntentResult {
        events = List.copyOf(events);
    }
}
