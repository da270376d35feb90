package com.tabletop.module;

import com.tabletop.exception.InsufficientFundsException;
import com.tabletop.exception.IntentRejectedException;
import com.tabletop.exception.RejectionReason;
import com.tabletop.model.PlayerRoster;
import com.tabletop.model.PlayerState;
import com.tabletop.model.PropertyRecord;
import com.tabletop.model.RuleConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Ownership of board properties, purchases, rent and trades.
 * <p>
 * Record owners and each player's owned-position set are always updated together.
 * Money moves through the {@link CurrencyLedger} before ownership changes.
 */
@Slf4j
public class PropertyRegistry {

    private final RuleConfiguration rules;
    private final CurrencyLedger ledger;
    private final PlayerRoster roster;
    private final Map<Integer, PropertyRecord> records = new TreeMap<>();

    public PropertyRegistry(RuleConfiguration rules, CurrencyLedger ledger, PlayerRoster roster) {
        if (ledger == null) {
            throw new IllegalArgumentException("Property registry requires a currency ledger");
        }
        this.rules = rules;
        this.ledger = ledger;
        this.roster = roster;
    }

    /**
     * Place a new unowned record.
     *
     * @return false if a record already occupies the position
     */
    public boolean place(PropertyRecord record) {
        if (records.containsKey(record.getPosition())) {
            return false;
        }
        record.release();
        records.put(record.getPosition(), record);
        return true;
    }

    public Optional<PropertyRecord> record(int position) {
        return Optional.ofNullable(records.get(position));
    }

    public Collection<PropertyRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    public List<PropertyRecord> ownedBy(int playerId) {
        return records.values().stream()
                .filter(r -> r.isOwnedBy(playerId))
                .toList();
    }

    /**
     * Resolve a player landing on {@code position}.
     */
    public LandingOutcome landOn(int playerId, int position) {
        PropertyRecord record = records.get(position);
        if (record == null) {
            return LandingOutcome.none(playerId, position);
        }

        if (!record.isOwned()) {
            if (!rules.isPurchasableProperties()) {
                return LandingOutcome.none(playerId, position);
            }
            return offerPurchase(playerId, record);
        }

        if (record.isOwnedBy(playerId)) {
            return LandingOutcome.builder()
                    .type(LandingOutcome.Type.OWN_PROPERTY)
                    .playerId(playerId)
                    .position(position)
                    .ownerId(playerId)
                    .balanceAfter(ledger.balance(playerId))
                    .build();
        }

        if (!rules.isRentCollectible() || !roster.isActive(record.getOwnerId())) {
            return LandingOutcome.none(playerId, position);
        }
        return chargeRent(playerId, record);
    }

    /**
     * Buy the unowned record at {@code position} outright.
     *
     * @throws IntentRejectedException if purchasing is disabled, there is nothing to buy, or the
     *                                 balance does not cover the price
     */
    public PropertyRecord purchase(int playerId, int position) {
        if (!rules.isPurchasableProperties()) {
            throw new IntentRejectedException(RejectionReason.FEATURE_DISABLED, "Property purchase is disabled");
        }
        PropertyRecord record = records.get(position);
        if (record == null) {
            throw new IntentRejectedException(RejectionReason.INVALID_TARGET, "No property at position " + position);
        }
        if (record.isOwned()) {
            throw new IntentRejectedException(RejectionReason.INVALID_TARGET,
                    record.getName() + " is already owned by player " + record.getOwnerId());
        }
        ledger.debit(playerId, record.getPurchasePrice());
        assign(record, playerId);
        log.info("Player {} purchased {} for {}", playerId, record.getName(), record.getPurchasePrice());
        return record;
    }

    /**
     * Check that a trade could go through right now without changing anything.
     *
     * @throws IntentRejectedException if trading is disabled, the record or parties are invalid,
     *                                 or the buyer cannot pay
     */
    public PropertyRecord checkTrade(int sellerId, int buyerId, int position, int price) {
        if (!rules.isTradableProperties()) {
            throw new IntentRejectedException(RejectionReason.FEATURE_DISABLED, "Property trading is disabled");
        }
        if (price < 0) {
            throw new IntentRejectedException(RejectionReason.INVALID_INTENT, "Trade price cannot be negative");
        }
        PropertyRecord record = records.get(position);
        if (record == null) {
            throw new IntentRejectedException(RejectionReason.INVALID_TARGET, "No property at position " + position);
        }
        if (!record.isOwnedBy(sellerId)) {
            throw new IntentRejectedException(RejectionReason.INVALID_TARGET,
                    "Player " + sellerId + " does not own " + record.getName());
        }
        if (sellerId == buyerId || !roster.isActive(buyerId) || !roster.isActive(sellerId)) {
            throw new IntentRejectedException(RejectionReason.INVALID_TARGET, "Invalid trade partner " + buyerId);
        }
        if (!ledger.canAfford(buyerId, price)) {
            throw new InsufficientFundsException(buyerId, price, ledger.balance(buyerId));
        }
        return record;
    }

    /**
     * Sell the record at {@code position} from {@code sellerId} to {@code buyerId}.
     * The buyer pays the seller; ownership changes only once the payment went through.
     *
     * @throws IntentRejectedException if {@link #checkTrade} fails
     */
    public PropertyRecord trade(int sellerId, int buyerId, int position, int price) {
        PropertyRecord record = checkTrade(sellerId, buyerId, position, price);
        ledger.transfer(buyerId, sellerId, price);
        unassign(record);
        assign(record, buyerId);
        log.info("Player {} sold {} to player {} for {}", sellerId, record.getName(), buyerId, price);
        return record;
    }

    /**
     * Release every record owned by a player.
     *
     * @return the released positions
     */
    public List<Integer> releaseAll(int playerId) {
        List<Integer> released = new ArrayList<>();
        for (PropertyRecord record : records.values()) {
            if (record.isOwnedBy(playerId)) {
                record.release();
                released.add(record.getPosition());
            }
        }
        roster.get(playerId).getOwnedPositions().clear();
        if (!released.isEmpty()) {
            log.info("Released {} properties of player {}", released.size(), playerId);
        }
        return released;
    }

    private LandingOutcome offerPurchase(int playerId, PropertyRecord record) {
        int price = record.getPurchasePrice();
        if (!ledger.canAfford(playerId, price)) {
            log.debug("Player {} cannot afford {} ({})", playerId, record.getName(), price);
            return LandingOutcome.builder()
                    .type(LandingOutcome.Type.PURCHASE_DECLINED)
                    .playerId(playerId)
                    .position(record.getPosition())
                    .amount(price)
                    .balanceAfter(ledger.balance(playerId))
                    .build();
        }
        purchase(playerId, record.getPosition());
        return LandingOutcome.builder()
                .type(LandingOutcome.Type.PURCHASED)
                .playerId(playerId)
                .position(record.getPosition())
                .ownerId(playerId)
                .amount(price)
                .balanceAfter(ledger.balance(playerId))
                .build();
    }

    private LandingOutcome chargeRent(int playerId, PropertyRecord record) {
        int ownerId = record.getOwnerId();
        int rent = record.getRentPrice();

        if (ledger.canAfford(playerId, rent)) {
            ledger.transfer(playerId, ownerId, rent);
            log.debug("Player {} paid {} rent to player {}", playerId, rent, ownerId);
            return LandingOutcome.builder()
                    .type(LandingOutcome.Type.RENT_PAID)
                    .playerId(playerId)
                    .position(record.getPosition())
                    .ownerId(ownerId)
                    .amount(rent)
                    .balanceAfter(ledger.balance(playerId))
                    .build();
        }

        if (!rules.isBankruptcyEnabled()) {
            log.debug("Player {} cannot pay {} rent; bankruptcy disabled", playerId, rent);
            return LandingOutcome.builder()
                    .type(LandingOutcome.Type.RENT_UNPAID)
                    .playerId(playerId)
                    .position(record.getPosition())
                    .ownerId(ownerId)
                    .amount(rent)
                    .balanceAfter(ledger.balance(playerId))
                    .build();
        }

        PlayerState player = roster.get(playerId);
        player.deactivate();
        List<Integer> released = releaseAll(playerId);
        log.info("Player {} is bankrupt: could not pay {} rent to player {}", playerId, rent, ownerId);
        return LandingOutcome.builder()
                .type(LandingOutcome.Type.BANKRUPT)
                .playerId(playerId)
                .position(record.getPosition())
                .ownerId(ownerId)
                .amount(rent)
                .balanceAfter(player.getBalance())
                .releasedPositions(List.copyOf(released))
                .build();
    }

    private void assign(PropertyRecord record, int playerId) {
        record.setOwnerId(playerId);
        roster.get(playerId).getOwnedPositions().add(record.getPosition());
    }

    private void unassign(PropertyRecord record) {
        if (record.isOwned()) {
            roster.get(record.getOwnerId()).getOwnedPositions().remove(record.getPosition());
            record.release();
        }
    }
}
