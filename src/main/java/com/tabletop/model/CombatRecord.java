package com.tabletop.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Health of one player. Whether the player is alive is always derived from health.
 */
@Getter
@ToString
public class CombatRecord {

    private final int playerId;
    private final int maxHealth;
    private int health;

    public CombatRecord(int playerId, int maxHealth) {
        if (maxHealth <= 0) {
            throw new IllegalArgumentException("Max health must be positive");
        }
        this.playerId = playerId;
        this.maxHealth = maxHealth;
        this.health = maxHealth;
    }

    public boolean isAlive() {
        return health > 0;
    }

    /**
     * Remove health, never going below zero.
     *
     * @return the damage actually absorbed
     */
    public int takeDamage(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Damage cannot be negative");
        }
        int absorbed = Math.min(amount, health);
        health -= absorbed;
        return absorbed;
    }
}
