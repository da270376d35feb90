package com.tabletop.model;

import com.tabletop.module.BoardModel;
import com.tabletop.module.CombatModel;
import com.tabletop.module.CurrencyLedger;
import com.tabletop.module.DiceRoller;
import com.tabletop.module.MovementModel;
import com.tabletop.module.PropertyRegistry;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Live state of one match. Owns the roster and every module; created by the composer and
 * mutated only by the turn resolver.
 * <p>
 * Optional modules are null when their enabling rule is off.
 */
@Getter
public class MatchState {

    private final String id;
    private final RuleConfiguration rules;
    private final Archetype archetype;
    private final BoardTopology topology;
    private final PlayerRoster roster;
    private final List<String> ruleWarnings;
    private final LocalDateTime createdAt;

    private BoardModel board;
    private MovementModel movement;
    private CurrencyLedger currency;
    private PropertyRegistry property;
    private CombatModel combat;
    private DiceRoller dice;

    @Setter
    private MatchStatus status;
    @Setter
    private TurnPhase phase;
    @Setter
    private int currentPlayerId;
    @Setter
    private int turnNumber;
    @Setter
    private Integer winnerId;
    @Setter
    private LocalDateTime endedAt;
    /** At most one open offer; it lapses when the turn passes. */
    @Setter
    private TradeOffer pendingTrade;

    @Builder
    private MatchState(String id, RuleConfiguration rules, Archetype archetype, PlayerRoster roster,
                       BoardModel board, MovementModel movement, CurrencyLedger currency,
                       PropertyRegistry property, CombatModel combat, DiceRoller dice,
                       List<String> ruleWarnings) {
        if (board == null || movement == null) {
            throw new IllegalArgumentException("Board and movement modules are mandatory");
        }
        if (property != null && currency == null) {
            throw new IllegalArgumentException("Property module requires Currency module");
        }
        this.id = id;
        this.rules = rules;
        this.archetype = archetype;
        this.roster = roster;
        this.board = board;
        this.movement = movement;
        this.currency = currency;
        this.property = property;
        this.combat = combat;
        this.dice = dice;
        this.ruleWarnings = ruleWarnings != null ? List.copyOf(ruleWarnings) : List.of();
        this.topology = board.topology();
        this.createdAt = LocalDateTime.now();
        this.status = MatchStatus.IN_PROGRESS;
        this.phase = TurnPhase.AWAITING_INTENT;
        this.currentPlayerId = 0;
        this.turnNumber = 1;
    }

    public PlayerState getCurrentPlayer() {
        return roster.get(currentPlayerId);
    }

    public boolean hasModule(ModuleType type) {
        return switch (type) {
            case BOARD -> board != null;
            case CURRENCY -> currency != null;
            case PROPERTY -> property != null;
            case COMBAT -> combat != null;
            case MOVEMENT -> movement != null;
        };
    }

    public Set<ModuleType> activeModules() {
        Set<ModuleType> modules = EnumSet.noneOf(ModuleType.class);
        for (ModuleType type : ModuleType.values()) {
            if (hasModule(type)) {
                modules.add(type);
            }
        }
        return modules;
    }

    public boolean isOver() {
        return phase == TurnPhase.MATCH_OVER;
    }

    /**
     * Drop every module reference once the match has ended or was aborted.
     */
    public void tearDown() {
        this.phase = TurnPhase.MATCH_OVER;
        this.board = null;
        this.movement = null;
        this.currency = null;
        this.property = null;
        this.combat = null;
        this.dice = null;
        this.pendingTrade = null;
    }
}
