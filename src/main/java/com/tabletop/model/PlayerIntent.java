package com.tabletop.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A single action proposed by a player, awaiting resolution.
 * Fields that do not apply to the intent type are left at zero.
 */
@Getter
@ToString
public class PlayerIntent {

    private final IntentType type;
    private final int playerId;
    private final int spaces;
    private final int targetPlayerId;
    private final int sellerId;
    private final int buyerId;
    private final int position;
    private final int price;

    private PlayerIntent(IntentType type, int playerId, int spaces, int targetPlayerId,
                         int sellerId, int buyerId, int position, int price) {
        this.type = type;
        this.playerId = playerId;
        this.spaces = spaces;
        this.targetPlayerId = targetPlayerId;
        this.sellerId = sellerId;
        this.buyerId = buyerId;
        this.position = position;
        this.price = price;
    }

    public enum IntentType {
        MOVE,
        ROLL,
        PURCHASE,
        TRADE,
        ACCEPT_TRADE,
        REJECT_TRADE,
        CANCEL_TRADE,
        ATTACK
    }

    public static PlayerIntent move(int playerId, int spaces) {
        return new PlayerIntent(IntentType.MOVE, playerId, spaces, 0, 0, 0, 0, 0);
    }

    public static PlayerIntent roll(int playerId) {
        return new PlayerIntent(IntentType.ROLL, playerId, 0, 0, 0, 0, 0, 0);
    }

    public static PlayerIntent purchase(int playerId) {
        return new PlayerIntent(IntentType.PURCHASE, playerId, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Offer to sell the property at {@code position} from {@code sellerId} to {@code buyerId}; the
     * buyer pays. The submitting player must be one of the two parties and nothing changes hands
     * until the other party accepts.
     */
    public static PlayerIntent trade(int playerId, int sellerId, int buyerId, int position, int price) {
        return new PlayerIntent(IntentType.TRADE, playerId, 0, 0, sellerId, buyerId, position, price);
    }

    /** Accept the offer waiting on this player. May be submitted outside the player's turn. */
    public static PlayerIntent acceptTrade(int playerId) {
        return new PlayerIntent(IntentType.ACCEPT_TRADE, playerId, 0, 0, 0, 0, 0, 0);
    }

    /** Turn down the offer waiting on this player. May be submitted outside the player's turn. */
    public static PlayerIntent rejectTrade(int playerId) {
        return new PlayerIntent(IntentType.REJECT_TRADE, playerId, 0, 0, 0, 0, 0, 0);
    }

    /** Withdraw this player's own open offer. */
    public static PlayerIntent cancelTrade(int playerId) {
        return new PlayerIntent(IntentType.CANCEL_TRADE, playerId, 0, 0, 0, 0, 0, 0);
    }

    public static PlayerIntent attack(int playerId, int targetPlayerId) {
        return new PlayerIntent(IntentType.ATTACK, playerId, 0, targetPlayerId, 0, 0, 0, 0);
    }
}
