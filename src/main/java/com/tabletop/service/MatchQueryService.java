package com.tabletop.service;

import com.tabletop.dto.MatchSnapshot;
import com.tabletop.dto.PlayerSnapshot;
import com.tabletop.dto.PropertySnapshot;
import com.tabletop.model.CombatRecord;
import com.tabletop.model.MatchState;
import com.tabletop.model.MatchStatus;
import com.tabletop.model.PlayerState;
import com.tabletop.module.CombatModel;
import com.tabletop.module.MovementModel;
import com.tabletop.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for match lookups and read-only snapshots.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchQueryService {

    private final MatchRepository matchRepository;

    /**
     * Get a live match by id.
     */
    public MatchState getMatch(String matchId) {
        return matchRepository.findById(matchId)
                .orElseThrow(() -> new IllegalArgumentException("Match not found: " + matchId));
    }

    public List<MatchState> getMatchesInProgress() {
        return matchRepository.findByStatus(MatchStatus.IN_PROGRESS);
    }

    /**
     * Copy the full match state. Callers must hold the match lock for a consistent view.
     */
    public MatchSnapshot snapshot(MatchState match) {
        return snapshot(match, null);
    }

    /**
     * Copy the match state as {@code observerId} sees it. Opponent tokens the observer cannot see
     * are marked hidden and carry no position.
     *
     * @param observerId player the view is for, or null for the full view
     * @throws IllegalArgumentException if the observer is not in the match
     */
    public MatchSnapshot snapshot(MatchState match, Integer observerId) {
        if (observerId != null && !match.getRoster().contains(observerId)) {
            throw new IllegalArgumentException("Unknown observer " + observerId + " in match " + match.getId());
        }
        MatchSnapshot snapshot = MatchSnapshot.fromMatch(match);
        snapshot.setObserverId(observerId);
        CombatModel combat = match.getCombat();
        MovementModel movement = match.getMovement();

        List<PlayerSnapshot> players = match.getRoster().all().stream()
                .map(p -> toPlayerSnapshot(p, combat, match.getCurrentPlayerId()))
                .map(p -> hideIfUnseen(p, movement, observerId))
                .toList();
        snapshot.setPlayers(players);

        snapshot.setProperties(match.getProperty() == null
                ? List.of()
                : match.getProperty().records().stream()
                        .map(PropertySnapshot::fromRecord)
                        .toList());
        return snapshot;
    }

    private PlayerSnapshot hideIfUnseen(PlayerSnapshot player, MovementModel movement, Integer observerId) {
        if (observerId != null && movement != null && !movement.canSee(observerId, player.getId())) {
            player.setPosition(null);
            player.setHidden(true);
        }
        return player;
    }

    private PlayerSnapshot toPlayerSnapshot(PlayerState player, CombatModel combat, int currentPlayerId) {
        CombatRecord record = combat != null ? combat.record(player.getId()) : null;
        PlayerSnapshot snapshot = PlayerSnapshot.fromPlayer(player, record);
        snapshot.setCurrentTurn(player.getId() == currentPlayerId && player.isActive());
        return snapshot;
    }
}
