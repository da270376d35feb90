package com.tabletop.service;

import com.tabletop.model.MatchState;
import com.tabletop.model.MatchStatus;
import com.tabletop.model.PlayerRoster;
import com.tabletop.model.PlayerState;
import com.tabletop.model.TurnPhase;
import com.tabletop.module.BoardModel;
import com.tabletop.module.MoveResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Service responsible for checking win conditions after every resolved intent.
 */
@Service
@Slf4j
public class WinConditionService {

    /**
     * Check whether the match is over and finish it if so.
     *
     * @param lastMove the move just resolved, or null when the intent did not move anyone
     * @return true if the match has ended
     */
    public boolean checkMatchOver(MatchState match, MoveResult lastMove) {
        PlayerRoster roster = match.getRoster();
        List<PlayerState> active = roster.active();

        if (active.isEmpty()) {
            finishMatch(match, null);
            return true;
        }

        // Last player standing, unless the match was a solo game from the start
        if (roster.size() > 1 && active.size() == 1) {
            int survivor = active.get(0).getId();
            if (match.getCombat() == null || match.getCombat().hasPlayerWon(survivor)) {
                finishMatch(match, survivor);
                return true;
            }
        }

        Integer winner = switch (match.getRules().getWinCondition()) {
            case ELIMINATION -> null;
            case BALANCE_THRESHOLD -> richestQualifyingPlayer(match, active);
            case REACH_GOAL -> goalReacher(match, lastMove);
        };
        if (winner != null) {
            finishMatch(match, winner);
            return true;
        }
        return false;
    }

    private Integer richestQualifyingPlayer(MatchState match, List<PlayerState> active) {
        int threshold = match.getRules().getWinningBalance();
        PlayerState best = null;
        for (PlayerState player : active) {
            if (player.getBalance() >= threshold && (best == null || player.getBalance() > best.getBalance())) {
                best = player;
            }
        }
        return best == null ? null : best.getId();
    }

    /**
     * A mover wins by landing on the goal; on a loop board completing a lap counts as well.
     */
    private Integer goalReacher(MatchState match, MoveResult move) {
        if (move == null || !match.getRoster().isActive(move.playerId())) {
            return null;
        }
        BoardModel board = match.getBoard();
        boolean reached = move.to() == board.goalPosition() || (!board.isGrid() && move.passedStart());
        return reached ? move.playerId() : null;
    }

    private void finishMatch(MatchState match, Integer winnerId) {
        match.setStatus(MatchStatus.FINISHED);
        match.setPhase(TurnPhase.MATCH_OVER);
        match.setWinnerId(winnerId);
        match.setEndedAt(LocalDateTime.now());
        if (winnerId == null) {
            log.info("Match {} finished with no active players left", match.getId());
        } else {
            log.info("Match {} finished. Winner: player {}", match.getId(), winnerId);
        }
    }
}
