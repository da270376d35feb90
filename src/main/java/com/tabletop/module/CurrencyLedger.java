package com.tabletop.module;

import com.tabletop.exception.InsufficientFundsException;
import com.tabletop.model.PlayerRoster;
import com.tabletop.model.PlayerState;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-player balances with atomic transfers.
 * Balances live on {@link PlayerState}; the ledger is the only writer.
 */
@Slf4j
public class CurrencyLedger {

    private final PlayerRoster roster;

    public CurrencyLedger(PlayerRoster roster) {
        this.roster = roster;
    }

    public int balance(int playerId) {
        return roster.get(playerId).getBalance();
    }

    public boolean canAfford(int playerId, int amount) {
        return balance(playerId) >= amount;
    }

    /**
     * Derived from the balance, never stored.
     */
    public boolean isBankrupt(int playerId) {
        return balance(playerId) <= 0;
    }

    /**
     * Add money. Always succeeds.
     *
     * @return the new balance
     */
    public int credit(int playerId, int amount) {
        requireNonNegative(amount);
        PlayerState player = roster.get(playerId);
        player.setBalance(player.getBalance() + amount);
        log.debug("Player {} credited {} (balance {})", playerId, amount, player.getBalance());
        return player.getBalance();
    }

    /**
     * Remove money if the balance covers it.
     *
     * @return the new balance
     * @throws InsufficientFundsException if the balance is below {@code amount}; the balance is unchanged
     */
    public int debit(int playerId, int amount) {
        requireNonNegative(amount);
        PlayerState player = roster.get(playerId);
        if (player.getBalance() < amount) {
            throw new InsufficientFundsException(playerId, amount, player.getBalance());
        }
        player.setBalance(player.getBalance() - amount);
        if (player.getBalance() < 0) {
            throw new IllegalStateException("Negative balance for player " + playerId + " after debit");
        }
        log.debug("Player {} debited {} (balance {})", playerId, amount, player.getBalance());
        return player.getBalance();
    }

    /**
     * Debit {@code from} then credit {@code to}. If the debit fails nothing changes.
     *
     * @throws InsufficientFundsException if {@code from} cannot cover the amount
     */
    public void transfer(int fromId, int toId, int amount) {
        requireNonNegative(amount);
        roster.get(toId);
        debit(fromId, amount);
        credit(toId, amount);
        log.debug("Transferred {} from player {} to player {}", amount, fromId, toId);
    }

    private static void requireNonNegative(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
    }
}
