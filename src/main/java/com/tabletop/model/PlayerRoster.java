package com.tabletop.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arena of every {@link PlayerState} in a match, indexed by player id.
 */
public class PlayerRoster {

    private final List<PlayerState> players = new ArrayList<>();

    /**
     * Append a new player; its id is its index in the roster.
     */
    public PlayerState enlist(int startingBalance) {
        PlayerState player = PlayerState.builder()
                .id(players.size())
                .position(0)
                .balance(startingBalance)
                .build();
        players.add(player);
        return player;
    }

    public PlayerState get(int playerId) {
        if (!contains(playerId)) {
            throw new IllegalArgumentException("Unknown player: " + playerId);
        }
        return players.get(playerId);
    }

    public boolean contains(int playerId) {
        return playerId >= 0 && playerId < players.size();
    }

    public boolean isActive(int playerId) {
        return contains(playerId) && players.get(playerId).isActive();
    }

    public List<PlayerState> all() {
        return Collections.unmodifiableList(players);
    }

    public List<PlayerState> active() {
        return players.stream()
                .filter(PlayerState::isActive)
                .toList();
    }

    public int activeCount() {
        return (int) players.stream().filter(PlayerState::isActive).count();
    }

    public int size() {
        return players.size();
    }
}
