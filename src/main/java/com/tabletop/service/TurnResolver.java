package com.tabletop.service;

import com.tabletop.event.MatchEvent;
import com.tabletop.exception.IntentRejectedException;
import com.tabletop.exception.RejectionReason;
import com.tabletop.model.MatchState;
import com.tabletop.model.MatchStatus;
import com.tabletop.model.PlayerIntent;
import com.tabletop.model.PlayerRoster;
import com.tabletop.model.PropertyRecord;
import com.tabletop.model.TradeOffer;
import com.tabletop.model.TurnPhase;
import com.tabletop.module.CombatModel;
import com.tabletop.module.CombatOutcome;
import com.tabletop.module.DiceRoll;
import com.tabletop.module.LandingOutcome;
import com.tabletop.module.MoveResult;
import com.tabletop.module.PropertyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies player intents to a match.
 * <p>
 * A move resolves in a fixed order: movement, pass bonus, property landing, combat landing,
 * release of eliminated players' properties, win check, turn advance. Callers must serialise
 * calls per match.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnResolver {

    private final WinConditionService winConditionService;

    /**
     * Resolve one intent.
     *
     * @return the events produced, in order
     * @throws IntentRejectedException if the intent is not legal right now; the match is unchanged
     */
    public IntentResult resolveIntent(MatchState match, PlayerIntent intent) {
        validate(match, intent);

        int playerId = intent.getPlayerId();
        List<MatchEvent> events = new ArrayList<>();
        MoveResult move = null;
        boolean endsTurn;

        match.setPhase(TurnPhase.RESOLVING);
        try {
            switch (intent.getType()) {
                case MOVE -> {
                    move = resolveMove(match, playerId, intent.getSpaces(), events);
                    endsTurn = true;
                }
                case ROLL -> {
                    DiceRoll roll = match.getDice().roll();
                    events.add(MatchEvent.diceRolled(match.getId(), playerId, roll.faces(), roll.total()));
                    move = resolveMove(match, playerId, roll.total(), events);
                    boolean extraTurn = match.getDice().grantsExtraTurn(roll)
                            && match.getRoster().isActive(playerId);
                    if (extraTurn) {
                        log.debug("Player {} rolled {} and keeps the turn", playerId, roll.faces());
                    }
                    endsTurn = !extraTurn;
                }
                case PURCHASE -> {
                    resolvePurchase(match, playerId, events);
                    endsTurn = false;
                }
                case TRADE -> {
                    proposeTrade(match, intent, events);
                    endsTurn = false;
                }
                case ACCEPT_TRADE -> {
                    acceptTrade(match, events);
                    endsTurn = false;
                }
                case REJECT_TRADE -> {
                    TradeOffer offer = closeOffer(match);
                    events.add(MatchEvent.tradeRejected(match.getId(), offer));
                    endsTurn = false;
                }
                case CANCEL_TRADE -> {
                    TradeOffer offer = closeOffer(match);
                    events.add(MatchEvent.tradeCancelled(match.getId(), offer));
                    endsTurn = false;
                }
                case ATTACK -> {
                    resolveAttack(match, playerId, intent.getTargetPlayerId(), events);
                    endsTurn = true;
                }
                default -> throw new IllegalStateException("Unhandled intent type: " + intent.getType());
            }
        } catch (IntentRejectedException e) {
            match.setPhase(TurnPhase.AWAITING_INTENT);
            throw e;
        }

        if (winConditionService.checkMatchOver(match, move)) {
            events.add(MatchEvent.matchOver(match.getId(), match.getWinnerId()));
            return new IntentResult(events, true, true, match.getCurrentPlayerId());
        }

        if (endsTurn || !match.getRoster().isActive(match.getCurrentPlayerId())) {
            advanceTurn(match, events);
            endsTurn = true;
        }
        match.setPhase(TurnPhase.AWAITING_INTENT);
        return new IntentResult(events, endsTurn, false, match.getCurrentPlayerId());
    }

    /**
     * Check everything that can be checked before touching state.
     */
    private void validate(MatchState match, PlayerIntent intent) {
        if (intent == null) {
            throw new IntentRejectedException(RejectionReason.INVALID_INTENT, "Intent is missing");
        }
        if (match.getStatus() != MatchStatus.IN_PROGRESS || match.isOver()) {
            throw new IntentRejectedException(RejectionReason.MATCH_OVER, "Match " + match.getId() + " is over");
        }
        PlayerRoster roster = match.getRoster();
        int playerId = intent.getPlayerId();
        if (!roster.contains(playerId)) {
            throw new IntentRejectedException(RejectionReason.UNKNOWN_PLAYER, "Unknown player: " + playerId);
        }
        if (!roster.isActive(playerId) || (!answersOffer(intent) && playerId != match.getCurrentPlayerId())) {
            throw new IntentRejectedException(RejectionReason.OUT_OF_TURN, "It is not player " + playerId + "'s turn");
        }

        switch (intent.getType()) {
            case MOVE -> {
                if (intent.getSpaces() < 0) {
                    throw new IntentRejectedException(RejectionReason.INVALID_INTENT,
                            "Cannot move a negative number of spaces");
                }
            }
            case ROLL -> {
                if (match.getDice() == null) {
                    throw new IntentRejectedException(RejectionReason.FEATURE_DISABLED, "Dice are not available");
                }
            }
            case PURCHASE -> {
                if (match.getProperty() == null) {
                    throw new IntentRejectedException(RejectionReason.FEATURE_DISABLED, "Property module is not active");
                }
            }
            case TRADE -> {
                if (match.getProperty() == null) {
                    throw new IntentRejectedException(RejectionReason.FEATURE_DISABLED, "Property module is not active");
                }
                if (!roster.contains(intent.getSellerId()) || !roster.contains(intent.getBuyerId())) {
                    throw new IntentRejectedException(RejectionReason.UNKNOWN_PLAYER, "Unknown trade party");
                }
                if (playerId != intent.getSellerId() && playerId != intent.getBuyerId()) {
                    throw new IntentRejectedException(RejectionReason.INVALID_INTENT,
                            "Player " + playerId + " is not a party to this trade");
                }
                if (match.getPendingTrade() != null) {
                    throw new IntentRejectedException(RejectionReason.INVALID_INTENT, "A trade offer is already open");
                }
                match.getProperty().checkTrade(intent.getSellerId(), intent.getBuyerId(),
                        intent.getPosition(), intent.getPrice());
            }
            case ACCEPT_TRADE, REJECT_TRADE -> {
                TradeOffer offer = match.getPendingTrade();
                if (offer == null || offer.counterpartyId() != playerId) {
                    throw new IntentRejectedException(RejectionReason.INVALID_INTENT,
                            "No trade offer is waiting on player " + playerId);
                }
            }
            case CANCEL_TRADE -> {
                TradeOffer offer = match.getPendingTrade();
                if (offer == null || offer.proposerId() != playerId) {
                    throw new IntentRejectedException(RejectionReason.INVALID_INTENT,
                            "Player " + playerId + " has no open trade offer");
                }
            }
            case ATTACK -> {
                if (match.getCombat() == null) {
                    throw new IntentRejectedException(RejectionReason.FEATURE_DISABLED, "Combat module is not active");
                }
                if (!roster.contains(intent.getTargetPlayerId())) {
                    throw new IntentRejectedException(RejectionReason.UNKNOWN_PLAYER,
                            "Unknown player: " + intent.getTargetPlayerId());
                }
            }
            default -> throw new IntentRejectedException(RejectionReason.INVALID_INTENT,
                    "Unsupported intent: " + intent.getType());
        }
    }

    private MoveResult resolveMove(MatchState match, int playerId, int spaces, List<MatchEvent> events) {
        String matchId = match.getId();

        // 1. movement
        MoveResult move = match.getMovement().move(playerId, spaces);
        events.add(MatchEvent.playerMoved(matchId, playerId, move.from(), move.to(), spaces));

        // 2. pass bonus, before anything on the landing space is charged
        if (move.passedStart()) {
            int bonus = match.getMovement().collectPassBonus(move);
            Integer balance = match.getCurrency() != null ? match.getCurrency().balance(playerId) : null;
            events.add(MatchEvent.passedStart(matchId, playerId, bonus, balance));
        }

        // 3. property landing
        if (match.getProperty() != null) {
            LandingOutcome landing = match.getProperty().landOn(playerId, move.to());
            recordLanding(matchId, landing, events);
        }

        // 4. combat landing
        CombatModel combat = match.getCombat();
        if (combat != null && match.getRoster().isActive(playerId)) {
            combat.resolveLanding(playerId, move.to())
                    .ifPresent(outcome -> recordCombat(match, outcome, events));
        }
        return move;
    }

    private void recordLanding(String matchId, LandingOutcome landing, List<MatchEvent> events) {
        int playerId = landing.getPlayerId();
        switch (landing.getType()) {
            case PURCHASED -> events.add(MatchEvent.propertyPurchased(matchId, playerId, landing.getPosition(),
                    landing.getAmount(), landing.getBalanceAfter()));
            case PURCHASE_DECLINED -> events.add(MatchEvent.purchaseDeclined(matchId, playerId,
                    landing.getPosition(), landing.getAmount()));
            case RENT_PAID -> events.add(MatchEvent.rentPaid(matchId, playerId, landing.getOwnerId(),
                    landing.getPosition(), landing.getAmount(), landing.getBalanceAfter()));
            case RENT_UNPAID -> events.add(MatchEvent.rentUnpaid(matchId, playerId, landing.getOwnerId(),
                    landing.getPosition(), landing.getAmount()));
            case BANKRUPT -> {
                events.add(MatchEvent.playerBankrupt(matchId, playerId, landing.getOwnerId(), landing.getBalanceAfter()));
                for (Integer position : landing.getReleasedPositions()) {
                    events.add(MatchEvent.propertyReleased(matchId, playerId, position));
                }
                events.add(MatchEvent.playerEliminated(matchId, playerId, landing.getOwnerId()));
            }
            case NONE, OWN_PROPERTY -> {
                // nothing changed
            }
        }
    }

    private void recordCombat(MatchState match, CombatOutcome outcome, List<MatchEvent> events) {
        String matchId = match.getId();
        events.add(MatchEvent.combatDamage(matchId, outcome.getAttackerId(), outcome.getTargetId(),
                outcome.getDamage(), outcome.getHealthAfter()));
        if (!outcome.isEliminated()) {
            return;
        }
        events.add(MatchEvent.playerEliminated(matchId, outcome.getTargetId(), outcome.getAttackerId()));
        PropertyRegistry property = match.getProperty();
        if (property != null) {
            for (Integer position : property.releaseAll(outcome.getTargetId())) {
                events.add(MatchEvent.propertyReleased(matchId, outcome.getTargetId(), position));
            }
        }
    }

    private void resolvePurchase(MatchState match, int playerId, List<MatchEvent> events) {
        int position = match.getRoster().get(playerId).getPosition();
        PropertyRecord record = match.getProperty().purchase(playerId, position);
        events.add(MatchEvent.propertyPurchased(match.getId(), playerId, position,
                record.getPurchasePrice(), match.getCurrency().balance(playerId)));
    }

    private static boolean answersOffer(PlayerIntent intent) {
        return intent.getType() == PlayerIntent.IntentType.ACCEPT_TRADE
                || intent.getType() == PlayerIntent.IntentType.REJECT_TRADE;
    }

    private void proposeTrade(MatchState match, PlayerIntent intent, List<MatchEvent> events) {
        TradeOffer offer = new TradeOffer(intent.getPlayerId(), intent.getSellerId(), intent.getBuyerId(),
                intent.getPosition(), intent.getPrice());
        match.setPendingTrade(offer);
        events.add(MatchEvent.tradeProposed(match.getId(), offer));
        log.debug("Player {} offered a trade to player {}: {}", offer.proposerId(), offer.counterpartyId(), offer);
    }

    /**
     * Execute the open offer. The offer is re-checked against the current state and stays open if
     * it can no longer go through.
     */
    private void acceptTrade(MatchState match, List<MatchEvent> events) {
        TradeOffer offer = match.getPendingTrade();
        match.getProperty().trade(offer.sellerId(), offer.buyerId(), offer.position(), offer.price());
        match.setPendingTrade(null);
        events.add(MatchEvent.propertyTraded(match.getId(), offer.sellerId(), offer.buyerId(),
                offer.position(), offer.price()));
    }

    private TradeOffer closeOffer(MatchState match) {
        TradeOffer offer = match.getPendingTrade();
        match.setPendingTrade(null);
        return offer;
    }

    private void resolveAttack(MatchState match, int attackerId, int targetId, List<MatchEvent> events) {
        CombatOutcome outcome = match.getCombat().attack(attackerId, targetId);
        log.debug("Player {} attacked player {} for {}", attackerId, targetId, outcome.getDamage());
        recordCombat(match, outcome, events);
    }

    /**
     * Pass the turn to the next active player, starting a new round on wrap-around.
     */
    void advanceTurn(MatchState match, List<MatchEvent> events) {
        PlayerRoster roster = match.getRoster();
        int previous = match.getCurrentPlayerId();
        int next = previous;
        int attempts = 0;
        boolean wrapped = false;
        do {
            int before = next;
            next = (next + 1) % roster.size();
            attempts++;
            if (next <= before) {
                wrapped = true;
            }
            if (attempts > roster.size()) {
                throw new IllegalStateException("No active players remaining");
            }
        } while (!roster.isActive(next));

        TradeOffer lapsed = match.getPendingTrade();
        if (lapsed != null) {
            match.setPendingTrade(null);
            events.add(MatchEvent.tradeCancelled(match.getId(), lapsed));
        }
        if (wrapped) {
            match.setTurnNumber(match.getTurnNumber() + 1);
        }
        match.setCurrentPlayerId(next);
        events.add(MatchEvent.turnChanged(match.getId(), previous, next, match.getTurnNumber()));
        log.debug("Turn passed from player {} to player {} (turn {})", previous, next, match.getTurnNumber());
    }
}
