package com.tabletop.model;

/**
 * A trade proposed by one party and waiting for the other to answer.
 * The buyer pays {@code price} to the seller for the property at {@code position}.
 */
public record TradeOffer(int proposerId, int sellerId, int buyerId, int position, int price) {

    public TradeOffer {
        if (proposerId != sellerId && proposerId != buyerId) {
            throw new IllegalArgumentException("Proposer must be a party to the trade");
        }
    }

    /** The party that has to accept or reject the offer. */
    public int counterpartyId() {
        return proposerId == sellerId ? buyerId : sellerId;
    }

    public boolean involves(int playerId) {
        return playerId == sellerId || playerId == buyerId;
    }
}
