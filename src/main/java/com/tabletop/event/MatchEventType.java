package com.tabletop.event;

public enum MatchEventType {
    MATCH_STARTED,
    DICE_ROLLED,
    PLAYER_MOVED,
    PASSED_START,
    PROPERTY_PURCHASED,
    PURCHASE_DECLINED,
    RENT_PAID,
    RENT_UNPAID,
    PLAYER_BANKRUPT,
    PROPERTY_RELEASED,
    TRADE_PROPOSED,
    TRADE_REJECTED,
    TRADE_CANCELLED,
    PROPERTY_TRADED,
    COMBAT_DAMAGE,
    PLAYER_ELIMINATED,
    TURN_CHANGED,
    MATCH_OVER,
    MATCH_ABORTED
}
