package com.tabletop.module;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What happened when a player landed on a position with the property module active.
 */
@Value
@Builder
public class LandingOutcome {

    public enum Type {
        NONE,               // No property at this position, or nothing applies
        PURCHASED,          // Auto-purchased
        PURCHASE_DECLINED,  // Unowned but the balance did not cover the price
        OWN_PROPERTY,       // Landed on a property the player owns
        RENT_PAID,
        RENT_UNPAID,        // Could not pay, bankruptcy disabled
        BANKRUPT            // Could not pay; player is out and released everything
    }

    Type type;
    int playerId;
    int position;
    Integer ownerId;
    int amount;
    int balanceAfter;
    @Builder.Default
    List<Integer> releasedPositions = List.of();

    public static LandingOutcome none(int playerId, int position) {
        return LandingOutcome.builder()
                .type(Type.NONE)
                .playerId(playerId)
                .position(position)
                .build();
    }
}
