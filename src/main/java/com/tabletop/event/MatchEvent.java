package com.tabletop.event;

import com.tabletop.model.TradeOffer;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Domain event emitted after an intent has been fully resolved.
 * <p>
 * Carries player ids and numeric deltas only, never references into the match state.
 * {@code amount} is the delta the event describes (money moved, spaces moved, damage dealt) and
 * {@code resultingValue} the value it left behind (new balance, new position, remaining health).
 */
@Value
@Builder
public class MatchEvent {

    MatchEventType type;
    String matchId;
    Integer playerId;
    Integer counterpartId;
    Integer position;
    int amount;
    Integer resultingValue;
    List<Integer> values;
    long timestamp;

    public static MatchEvent matchStarted(String matchId, int playerCount) {
        return MatchEvent.builder()
                .type(MatchEventType.MATCH_STARTED)
                .matchId(matchId)
                .amount(playerCount)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent diceRolled(String matchId, int playerId, List<Integer> faces, int total) {
        return MatchEvent.builder()
                .type(MatchEventType.DICE_ROLLED)
                .matchId(matchId)
                .playerId(playerId)
                .amount(total)
                .values(List.copyOf(faces))
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent playerMoved(String matchId, int playerId, int from, int to, int spaces) {
        return MatchEvent.builder()
                .type(MatchEventType.PLAYER_MOVED)
                .matchId(matchId)
                .playerId(playerId)
                .position(from)
                .amount(spaces)
                .resultingValue(to)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    /**
     * @param balanceAfter null when the match has no currency
     */
    public static MatchEvent passedStart(String matchId, int playerId, int bonus, Integer balanceAfter) {
        return MatchEvent.builder()
                .type(MatchEventType.PASSED_START)
                .matchId(matchId)
                .playerId(playerId)
                .position(0)
                .amount(bonus)
                .resultingValue(balanceAfter)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent propertyPurchased(String matchId, int playerId, int position, int price, int balanceAfter) {
        return MatchEvent.builder()
                .type(MatchEventType.PROPERTY_PURCHASED)
                .matchId(matchId)
                .playerId(playerId)
                .position(position)
                .amount(-price)
                .resultingValue(balanceAfter)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent purchaseDeclined(String matchId, int playerId, int position, int price) {
        return MatchEvent.builder()
                .type(MatchEventType.PURCHASE_DECLINED)
                .matchId(matchId)
                .playerId(playerId)
                .position(position)
                .amount(price)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent rentPaid(String matchId, int payerId, int ownerId, int position, int rent, int payerBalance) {
        return MatchEvent.builder()
                .type(MatchEventType.RENT_PAID)
                .matchId(matchId)
                .playerId(payerId)
                .counterpartId(ownerId)
                .position(position)
                .amount(rent)
                .resultingValue(payerBalance)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent rentUnpaid(String matchId, int payerId, int ownerId, int position, int rent) {
        return MatchEvent.builder()
                .type(MatchEventType.RENT_UNPAID)
                .matchId(matchId)
                .playerId(payerId)
                .counterpartId(ownerId)
                .position(position)
                .amount(rent)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent playerBankrupt(String matchId, int playerId, Integer creditorId, int balance) {
        return MatchEvent.builder()
                .type(MatchEventType.PLAYER_BANKRUPT)
                .matchId(matchId)
                .playerId(playerId)
                .counterpartId(creditorId)
                .resultingValue(balance)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent propertyReleased(String matchId, int previousOwnerId, int position) {
        return MatchEvent.builder()
                .type(MatchEventType.PROPERTY_RELEASED)
                .matchId(matchId)
                .playerId(previousOwnerId)
                .position(position)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent propertyTraded(String matchId, int sellerId, int buyerId, int position, int price) {
        return MatchEvent.builder()
                .type(MatchEventType.PROPERTY_TRADED)
                .matchId(matchId)
                .playerId(sellerId)
                .counterpartId(buyerId)
                .position(position)
                .amount(price)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent tradeProposed(String matchId, TradeOffer offer) {
        return tradeEvent(MatchEventType.TRADE_PROPOSED, matchId, offer);
    }

    public static MatchEvent tradeRejected(String matchId, TradeOffer offer) {
        return tradeEvent(MatchEventType.TRADE_REJECTED, matchId, offer);
    }

    public static MatchEvent tradeCancelled(String matchId, TradeOffer offer) {
        return tradeEvent(MatchEventType.TRADE_CANCELLED, matchId, offer);
    }

    private static MatchEvent tradeEvent(MatchEventType type, String matchId, TradeOffer offer) {
        return MatchEvent.builder()
                .type(type)
                .matchId(matchId)
                .playerId(offer.proposerId())
                .counterpartId(offer.counterpartyId())
                .position(offer.position())
                .amount(offer.price())
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent combatDamage(String matchId, Integer attackerId, int targetId, int damage, int healthAfter) {
        return MatchEvent.builder()
                .type(MatchEventType.COMBAT_DAMAGE)
                .matchId(matchId)
                .playerId(targetId)
                .counterpartId(attackerId)
                .amount(-damage)
                .resultingValue(healthAfter)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent playerEliminated(String matchId, int playerId, Integer eliminatedBy) {
        return MatchEvent.builder()
                .type(MatchEventType.PLAYER_ELIMINATED)
                .matchId(matchId)
                .playerId(playerId)
                .counterpartId(eliminatedBy)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent turnChanged(String matchId, int previousPlayerId, int nextPlayerId, int turnNumber) {
        return MatchEvent.builder()
                .type(MatchEventType.TURN_CHANGED)
                .matchId(matchId)
                .playerId(nextPlayerId)
                .counterpartId(previousPlayerId)
                .resultingValue(turnNumber)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent matchOver(String matchId, Integer winnerId) {
        return MatchEvent.builder()
                .type(MatchEventType.MATCH_OVER)
                .matchId(matchId)
                .playerId(winnerId)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static MatchEvent matchAborted(String matchId) {
        return MatchEvent.builder()
                .type(MatchEventType.MATCH_ABORTED)
                .matchId(matchId)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
