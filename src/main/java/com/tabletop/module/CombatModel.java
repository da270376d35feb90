package com.tabletop.module;

import com.tabletop.config.CombatProperties;
import com.tabletop.config.DamageRange;
import com.tabletop.exception.IntentRejectedException;
import com.tabletop.exception.RejectionReason;
import com.tabletop.model.CombatRecord;
import com.tabletop.model.PlayerRoster;
import com.tabletop.model.PlayerState;
import com.tabletop.model.RuleConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-player health and damage resolution.
 * <p>
 * Health is kept in a side table keyed by player id. A player whose health reaches zero is
 * marked inactive on the roster in the same call.
 */
@Slf4j
public class CombatModel {

    private final RuleConfiguration rules;
    private final CombatProperties properties;
    private final PlayerRoster roster;
    private final RandomSource random;
    private final Map<Integer, CombatRecord> records = new LinkedHashMap<>();

    public CombatModel(RuleConfiguration rules, CombatProperties properties, PlayerRoster roster, RandomSource random) {
        this.rules = rules;
        this.properties = properties;
        this.roster = roster;
        this.random = random;
        for (PlayerState player : roster.all()) {
            records.put(player.getId(), new CombatRecord(player.getId(), properties.startingHealth()));
        }
    }

    public CombatRecord record(int playerId) {
        CombatRecord record = records.get(playerId);
        if (record == null) {
            throw new IllegalArgumentException("No combat record for player " + playerId);
        }
        return record;
    }

    public Collection<CombatRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    public boolean isCombatSpace(int position) {
        return position > 0 && position % properties.triggerInterval() == 0;
    }

    /**
     * Resolve a player landing on {@code position}. Separate boards fight the environment,
     * a shared board hits the nearest other active player.
     *
     * @return the damage dealt, empty when the position is not a combat space or there is no target
     */
    public Optional<CombatOutcome> resolveLanding(int playerId, int position) {
        if (!isCombatSpace(position)) {
            return Optional.empty();
        }
        log.debug("Player {} entered combat space {}", playerId, position);

        if (rules.isSeparateBoards()) {
            return Optional.of(damage(CombatOutcome.Trigger.ENVIRONMENT, null, playerId,
                    properties.environmentDamage()));
        }

        Optional<Integer> target = nearestOpponent(playerId);
        if (target.isEmpty()) {
            log.debug("No target in range for player {}", playerId);
            return Optional.empty();
        }
        return Optional.of(damage(CombatOutcome.Trigger.LANDING, playerId, target.get(),
                properties.landingDamage()));
    }

    /**
     * Direct attack on another active player.
     *
     * @throws IntentRejectedException if the target is the attacker, unknown or already out
     */
    public CombatOutcome attack(int attackerId, int targetId) {
        if (attackerId == targetId || !roster.isActive(targetId)) {
            throw new IntentRejectedException(RejectionReason.INVALID_TARGET,
                    "Player " + targetId + " cannot be attacked");
        }
        return damage(CombatOutcome.Trigger.ATTACK, attackerId, targetId, properties.attackDamage());
    }

    /**
     * Apply a fixed amount of damage from the given trigger.
     *
     * @param attackerId null for environment encounters
     */
    public CombatOutcome applyDamage(CombatOutcome.Trigger trigger, Integer attackerId, int targetId, int amount) {
        CombatRecord record = record(targetId);
        record.takeDamage(amount);
        boolean eliminated = false;
        if (!record.isAlive() && roster.get(targetId).isActive()) {
            roster.get(targetId).deactivate();
            eliminated = true;
            log.info("Player {} has been eliminated", targetId);
        }
        return CombatOutcome.builder()
                .trigger(trigger)
                .attackerId(attackerId)
                .targetId(targetId)
                .damage(amount)
                .healthAfter(record.getHealth())
                .eliminated(eliminated)
                .build();
    }

    public boolean isAlive(int playerId) {
        return record(playerId).isAlive();
    }

    /**
     * True only when exactly one active player remains and it is {@code playerId}.
     * Recomputed from the roster on every call.
     */
    public boolean hasPlayerWon(int playerId) {
        return roster.activeCount() == 1 && roster.isActive(playerId);
    }

    private CombatOutcome damage(CombatOutcome.Trigger trigger, Integer attackerId, int targetId, DamageRange range) {
        int amount = range.roll(random);
        CombatOutcome outcome = applyDamage(trigger, attackerId, targetId, amount);
        log.debug("{} damage {} to player {} (health {})", trigger, amount, targetId, outcome.getHealthAfter());
        return outcome;
    }

    private Optional<Integer> nearestOpponent(int playerId) {
        int origin = roster.get(playerId).getPosition();
        Integer nearest = null;
        int minDistance = Integer.MAX_VALUE;
        for (PlayerState other : roster.all()) {
            if (other.getId() == playerId || !other.isActive()) {
                continue;
            }
            int distance = Math.abs(other.getPosition() - origin);
            if (distance < minDistance) {
                minDistance = distance;
                nearest = other.getId();
            }
        }
        return Optional.ofNullable(nearest);
    }
}
