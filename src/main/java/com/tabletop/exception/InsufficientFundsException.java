package com.tabletop.exception;

import lombok.Getter;

/**
 * A debit was attempted for more than the player's balance.
 */
@Getter
public class InsufficientFundsException extends IntentRejectedException {

    private final int playerId;
    private final int required;
    private final int available;

    public InsufficientFundsException(int playerId, int required, int available) {
        super(RejectionReason.INSUFFICIENT_FUNDS,
                "Player " + playerId + " needs " + required + " but has " + available);
        this.playerId = playerId;
        this.required = required;
        this.available = available;
    }
}
