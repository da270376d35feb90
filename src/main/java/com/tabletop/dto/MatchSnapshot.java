package com.tabletop.dto;

import com.tabletop.model.Archetype;
import com.tabletop.model.BoardShape;
import com.tabletop.model.MatchState;
import com.tabletop.model.MatchStatus;
import com.tabletop.model.ModuleType;
import com.tabletop.model.TradeOffer;
import com.tabletop.model.TurnPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Point-in-time copy of a match. Holds no references into the live state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MatchSnapshot {

    private String matchId;
    private Archetype archetype;
    private MatchStatus status;
    private TurnPhase phase;
    private int boardSize;
    private BoardShape boardShape;
    private Set<ModuleType> modules;
    private int currentPlayerId;
    private int turnNumber;
    private Integer winnerId;
    /** Player the view was taken for, or null for the full view. */
    private Integer observerId;
    private TradeOffer pendingTrade;
    private List<String> ruleWarnings;
    private List<PlayerSnapshot> players;
    private List<PropertySnapshot> properties;
    private LocalDateTime createdAt;
    private LocalDateTime endedAt;

    public static MatchSnapshot fromMatch(MatchState match) {
        return MatchSnapshot.builder()
                .matchId(match.getId())
                .archetype(match.getArchetype())
                .status(match.getStatus())
                .phase(match.getPhase())
                .boardSize(match.getTopology().size())
                .boardShape(match.getTopology().shape())
                .modules(Set.copyOf(match.activeModules()))
                .currentPlayerId(match.getCurrentPlayerId())
                .turnNumber(match.getTurnNumber())
                .winnerId(match.getWinnerId())
                .pendingTrade(match.getPendingTrade())
                .ruleWarnings(match.getRuleWarnings())
                .createdAt(match.getCreatedAt())
                .endedAt(match.getEndedAt())
                .build();
    }
}
