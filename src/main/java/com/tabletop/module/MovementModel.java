package com.tabletop.module;

import com.tabletop.model.PlayerRoster;
import com.tabletop.model.PlayerState;
import com.tabletop.model.RuleConfiguration;
import lombok.extern.slf4j.Slf4j;

/**
 * Position updates, wrap-around and distances. Board size always comes from {@link BoardModel}.
 */
@Slf4j
public class MovementModel {

    private final BoardModel board;
    private final PlayerRoster roster;
    private final CurrencyLedger ledger;
    private final RuleConfiguration rules;

    /**
     * @param ledger may be null when currency is disabled; the pass bonus is then never paid
     */
    public MovementModel(BoardModel board, PlayerRoster roster, CurrencyLedger ledger, RuleConfiguration rules) {
        this.board = board;
        this.roster = roster;
        this.ledger = ledger;
        this.rules = rules;
    }

    /**
     * Advance a player. Grid boards stop at the last position; loop boards wrap and report
     * passing start at most once per call, however many laps the move covers.
     */
    public MoveResult move(int playerId, int spaces) {
        if (spaces < 0) {
            throw new IllegalArgumentException("Cannot move a negative number of spaces");
        }
        PlayerState player = roster.get(playerId);
        int from = player.getPosition();
        int to;
        boolean passedStart = false;

        if (board.isGrid()) {
            to = (int) Math.min((long) from + spaces, board.size() - 1);
        } else {
            long target = (long) from + spaces;
            to = (int) (target % board.size());
            passedStart = target >= board.size();
        }

        player.setPosition(to);
        if (passedStart) {
            log.debug("Player {} passed start", playerId);
        }
        log.debug("Player {} moved from {} to {}", playerId, from, to);
        return new MoveResult(playerId, from, to, spaces, passedStart);
    }

    /**
     * Credit the pass bonus for a move that passed start.
     *
     * @return the amount credited, 0 when nothing was paid
     */
    public int collectPassBonus(MoveResult move) {
        if (!move.passedStart() || ledger == null || rules.getPassBonus() <= 0) {
            return 0;
        }
        ledger.credit(move.playerId(), rules.getPassBonus());
        return rules.getPassBonus();
    }

    /**
     * Place a player directly on a position. Never wraps and never passes start.
     */
    public MoveResult teleport(int playerId, int target) {
        if (!board.isValidPosition(target)) {
            throw new IllegalArgumentException("Position " + target + " is off the board");
        }
        PlayerState player = roster.get(playerId);
        int from = player.getPosition();
        player.setPosition(target);
        log.debug("Player {} teleported from {} to {}", playerId, from, target);
        return new MoveResult(playerId, from, target, 0, false);
    }

    public int distance(int from, int to) {
        if (board.isGrid()) {
            return Math.abs(to - from);
        }
        int size = board.size();
        int forward = Math.floorMod(to - from, size);
        int backward = Math.floorMod(from - to, size);
        return Math.min(forward, backward);
    }

    /**
     * Whether {@code observerId} can see the token of {@code targetId} under the visibility rules.
     */
    public boolean canSee(int observerId, int targetId) {
        if (observerId == targetId) {
            return true;
        }
        if (!rules.isEnemyTokensVisible()) {
            return false;
        }
        int range = rules.getEnemyVisibilityRange();
        if (range < 0) {
            return true;
        }
        return distance(roster.get(observerId).getPosition(), roster.get(targetId).getPosition()) <= range;
    }
}
