package com.tabletop.service;

import com.tabletop.model.Archetype;
import com.tabletop.model.RuleAnalysis;
import com.tabletop.model.RuleConfiguration;
import com.tabletop.model.WinCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a rule configuration into an archetype and checks it for contradictions.
 * Stateless: the same configuration always yields the same analysis.
 */
@Service
@Slf4j
public class RuleAnalyzer {

    static final int MIN_TILES_PER_SIDE = 4;

    /**
     * Classify the rules. Any contradiction yields an invalid {@link Archetype#HYBRID}.
     */
    public RuleAnalysis classify(RuleConfiguration rules) {
        if (rules == null) {
            return RuleAnalysis.invalid(List.of("Rule configuration is missing"));
        }

        List<String> conflicts = findConflicts(rules);
        if (!conflicts.isEmpty()) {
            log.debug("Rule configuration rejected: {}", conflicts);
            return RuleAnalysis.invalid(conflicts);
        }

        Archetype archetype = detectArchetype(rules);
        log.debug("Rule configuration classified as {}", archetype);
        return RuleAnalysis.valid(archetype);
    }

    /**
     * Non-fatal advice about rules that are legal but unusual.
     */
    public List<String> warnings(RuleConfiguration rules) {
        List<String> warnings = new ArrayList<>();
        if (rules.isCurrencyEnabled() && rules.getStartingBalance() == 0) {
            warnings.add("Currency enabled but starting balance is 0");
        }
        if (!rules.isEnemyTokensVisible() && rules.getEnemyVisibilityRange() == 0) {
            warnings.add("Enemy tokens are completely hidden");
        }
        if (rules.isSeparateBoards() && rules.isTradableProperties()) {
            warnings.add("Property trading on separate boards lets players trade spaces they never share");
        }
        if (rules.isShipPlacement() && rules.getTilesPerSide() < 8) {
            warnings.add("Ship placement is usually played on at least an 8x8 grid");
        }
        return warnings;
    }

    /**
     * Fixed precedence: the first matching shape wins, so extra feature blocks on top of a
     * grid-combat or trading shape keep that archetype and only add modules.
     */
    private Archetype detectArchetype(RuleConfiguration rules) {
        if (rules.isSeparateBoards() && rules.isShipPlacement()) {
            return Archetype.GRID_COMBAT;
        } else if (rules.isCurrencyEnabled() && rules.isPurchasableProperties() && !rules.isSeparateBoards()) {
            return Archetype.TRADING;
        } else if (!rules.hasTradingFeatures() && !rules.hasCombatFeatures()) {
            return Archetype.RACE;
        }
        return Archetype.HYBRID;
    }

    private List<String> findConflicts(RuleConfiguration rules) {
        List<String> conflicts = new ArrayList<>();

        // players
        if (rules.getMinPlayers() < 1) {
            conflicts.add("players.min must be at least 1");
        }
        if (rules.getMaxPlayers() < rules.getMinPlayers()) {
            conflicts.add("players.max must be greater than or equal to players.min");
        }

        // board
        if (rules.getTilesPerSide() < MIN_TILES_PER_SIDE) {
            conflicts.add("board.tilesPerSide must be at least " + MIN_TILES_PER_SIDE);
            if (rules.isCombatEnabled()) {
                conflicts.add("combat.enabled requires a board");
            }
        }

        // currency
        if (rules.isCurrencyEnabled() && rules.getStartingBalance() < 0) {
            conflicts.add("currency.startingBalance cannot be negative");
        }
        if (rules.isCurrencyEnabled() && rules.getPassBonus() < 0) {
            conflicts.add("currency.passBonus cannot be negative");
        }

        // property
        if (rules.isTradableProperties() && !rules.isPurchasableProperties()) {
            conflicts.add("property.tradable requires property.purchasable");
        }
        if (rules.isRentCollectible() && !rules.isPurchasableProperties()) {
            conflicts.add("property.rentCollectible requires property.purchasable");
        }
        if (rules.isPurchasableProperties() && !rules.isCurrencyEnabled()) {
            conflicts.add("property.purchasable requires currency.enabled");
        }
        if (rules.isBankruptcyEnabled() && !rules.isCurrencyEnabled()) {
            conflicts.add("property.bankruptcyEnabled requires currency.enabled");
        }

        // combat
        if (rules.isShipPlacement() && !rules.isCombatEnabled()) {
            conflicts.add("combat.shipPlacement requires combat.enabled");
        }
        if (rules.isShipPlacement() && !rules.isSeparateBoards()) {
            conflicts.add("combat.shipPlacement requires board.separateBoards");
        }

        // win condition
        if (rules.getWinCondition() == null) {
            conflicts.add("win.condition is required");
        } else if (rules.getWinCondition() == WinCondition.BALANCE_THRESHOLD) {
            if (!rules.isCurrencyEnabled()) {
                conflicts.add("win.balanceThreshold requires currency.enabled");
            }
            if (rules.getWinningBalance() <= 0) {
                conflicts.add("win.winningBalance must be greater than 0");
            }
        }

        // dice
        if (rules.getDiceCount() < 1) {
            conflicts.add("dice.count must be at least 1");
        }
        if (rules.getDiceSides() < 2) {
            conflicts.add("dice.sides must be at least 2");
        }
        if (rules.isDuplicatesGrantExtraTurn()) {
            if (rules.getDuplicatesRequired() < 2) {
                conflicts.add("dice.duplicatesRequired must be at least 2");
            } else if (rules.getDuplicatesRequired() > rules.getDiceCount()) {
                conflicts.add("dice.duplicatesRequired cannot exceed dice.count");
            }
        }

        // resources
        if (rules.isResourcesEnabled()) {
            List<String> names = rules.getResourceNames() == null ? List.of() : rules.getResourceNames();
            if (rules.getResourceCount() < 1) {
                conflicts.add("resources.count must be at least 1 when resources are enabled");
            }
            if (names.size() != rules.getResourceCount()) {
                conflicts.add("resources.names must match resources.count");
            }
            for (int i = 0; i < names.size(); i++) {
                if (names.get(i) == null || names.get(i).isBlank()) {
                    conflicts.add("resources.names[" + i + "] cannot be empty");
                }
            }
            if (rules.isResourceCapEnabled() && rules.getMaxResourcesPerType() < 1) {
                conflicts.add("resources.maxPerType must be at least 1");
            }
        }

        return conflicts;
    }
}
