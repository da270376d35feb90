package com.tabletop.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Declarative rule set a match is composed from. Immutable once a match starts.
 * <p>
 * Every {@code *Enabled} flag gates a block of fields that is meaningless while the flag is off,
 * e.g. {@link #getPassBonus()} is ignored when currency is disabled.
 */
@Value
@Builder(toBuilder = true)
public class RuleConfiguration {

    // ── currency ──
    @Builder.Default
    boolean currencyEnabled = true;
    @Builder.Default
    int startingBalance = 1500;
    @Builder.Default
    int passBonus = 200;

    // ── board ──
    @Builder.Default
    boolean separateBoards = false;
    @Builder.Default
    int tilesPerSide = 20;

    // ── property ──
    @Builder.Default
    boolean purchasableProperties = false;
    @Builder.Default
    boolean tradableProperties = false;
    @Builder.Default
    boolean rentCollectible = false;
    @Builder.Default
    boolean bankruptcyEnabled = false;

    // ── combat ──
    @Builder.Default
    boolean combatEnabled = false;
    /** Selects the grid-combat archetype; no module places ships or tracks hits. */
    @Builder.Default
    boolean shipPlacement = false;

    // ── visibility ──
    @Builder.Default
    boolean enemyTokensVisible = true;
    /** -1 means unlimited. */
    @Builder.Default
    int enemyVisibilityRange = -1;

    // ── players ──
    @Builder.Default
    int minPlayers = 2;
    @Builder.Default
    int maxPlayers = 4;

    // ── win condition ──
    @Builder.Default
    WinCondition winCondition = WinCondition.ELIMINATION;
    @Builder.Default
    int winningBalance = 5000;

    // ── dice ──
    @Builder.Default
    int diceCount = 1;
    @Builder.Default
    int diceSides = 6;
    @Builder.Default
    boolean duplicatesGrantExtraTurn = false;
    @Builder.Default
    int duplicatesRequired = 2;

    // ── resources ──
    @Builder.Default
    boolean resourcesEnabled = false;
    @Builder.Default
    int resourceCount = 0;
    @Builder.Default
    List<String> resourceNames = List.of();
    @Builder.Default
    boolean resourceCapEnabled = false;
    @Builder.Default
    int maxResourcesPerType = 10;

    /**
     * Configuration with every field at its default value.
     */
    public static RuleConfiguration defaults() {
        return RuleConfiguration.builder().build();
    }

    public boolean hasTradingFeatures() {
        return currencyEnabled || purchasableProperties || tradableProperties || rentCollectible;
    }

    public boolean hasCombatFeatures() {
        return combatEnabled || shipPlacement;
    }
}
