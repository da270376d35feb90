package com.tabletop.service;

import com.tabletop.config.CombatProperties;
import com.tabletop.event.MatchEvent;
import com.tabletop.event.MatchEventType;
import com.tabletop.exception.IntentRejectedException;
import com.tabletop.exception.RejectionReason;
import com.tabletop.model.MatchState;
import com.tabletop.model.MatchStatus;
import com.tabletop.model.PlayerIntent;
import com.tabletop.model.PlayerRoster;
import com.tabletop.model.PropertyRecord;
import com.tabletop.model.RuleConfiguration;
import com.tabletop.model.TurnPhase;
import com.tabletop.model.WinCondition;
import com.tabletop.module.BoardModel;
import com.tabletop.module.CombatModel;
import com.tabletop.module.CombatOutcome;
import com.tabletop.module.CurrencyLedger;
import com.tabletop.module.DiceRoller;
import com.tabletop.module.MovementModel;
import com.tabletop.module.PropertyRegistry;
import com.tabletop.module.RandomSource;
import com.tabletop.module.ScriptedRandomSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tabletop.event.MatchEventType.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TurnResolver: resolution order, rejections, turn advance and win conditions.
 */
class TurnResolverTest {

    private TurnResolver turnResolver;

    @BeforeEach
    void setUp() {
        turnResolver = new TurnResolver(new WinConditionService());
    }

    // ── fixtures ────────────────────────────────────────────────────────

    private static RuleConfiguration.RuleConfigurationBuilder trading() {
        return RuleConfiguration.builder()
                .purchasableProperties(true)
                .tradableProperties(true)
                .rentCollectible(true)
                .bankruptcyEnabled(true);
    }

    private static RuleConfiguration.RuleConfigurationBuilder race() {
        return RuleConfiguration.builder()
                .currencyEnabled(false)
                .winCondition(WinCondition.REACH_GOAL);
    }

    private static RuleConfiguration gridCombat() {
        return RuleConfiguration.builder()
                .currencyEnabled(false)
                .separateBoards(true)
                .combatEnabled(true)
                .shipPlacement(true)
                .tilesPerSide(10)
                .build();
    }

    private static PropertyRecord property(int position, int price, int rent) {
        return PropertyRecord.builder()
                .position(position)
                .name("Property at " + position)
                .purchasePrice(price)
                .rentPrice(rent)
                .build();
    }

    private static MatchState match(RuleConfiguration rules, int players, RandomSource random,
                                    PropertyRecord... records) {
        PlayerRoster roster = new PlayerRoster();
        for (int i = 0; i < players; i++) {
            roster.enlist(rules.isCurrencyEnabled() ? rules.getStartingBalance() : 0);
        }
        BoardModel board = new BoardModel(rules);
        CurrencyLedger currency = rules.isCurrencyEnabled() ? new CurrencyLedger(roster) : null;
        PropertyRegistry property = null;
        if (rules.isPurchasableProperties()) {
            property = new PropertyRegistry(rules, currency, roster);
            for (PropertyRecord record : records) {
                property.place(record);
            }
        }
        CombatModel combat = rules.isCombatEnabled()
                ? new CombatModel(rules, CombatProperties.defaults(), roster, random)
                : null;
        return MatchState.builder()
                .id("match-1")
                .rules(rules)
                .archetype(new RuleAnalyzer().classify(rules).archetype())
                .roster(roster)
                .board(board)
                .movement(new MovementModel(board, roster, currency, rules))
                .currency(currency)
                .property(property)
                .combat(combat)
                .dice(new DiceRoller(rules, random))
                .build();
    }

    private static List<MatchEventType> types(IntentResult result) {
        return result.events().stream().map(MatchEvent::getType).toList();
    }

    private void assertRejected(RejectionReason reason, MatchState match, PlayerIntent intent) {
        int current = match.getCurrentPlayerId();
        int turn = match.getTurnNumber();

        IntentRejectedException ex = assertThrows(IntentRejectedException.class,
                () -> turnResolver.resolveIntent(match, intent));

        assertEquals(reason, ex.getReason());
        assertEquals(current, match.getCurrentPlayerId());
        assertEquals(turn, match.getTurnNumber());
    }

    // ── tests ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("MOVE resolution order")
    class MoveTests {

        @Test
        @DisplayName("35 + 10 on a 40-space loop should pay the pass bonus before buying on space 5")
        void passBonusBeforeLanding() {
            MatchState match = match(trading().startingBalance(100).passBonus(200).build(), 2,
                    ScriptedRandomSource.constant(0), property(5, 250, 25));
            match.getRoster().get(0).setPosition(35);

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 10));

            assertEquals(List.of(PLAYER_MOVED, PASSED_START, PROPERTY_PURCHASED, TURN_CHANGED), types(result));
            assertEquals(5, match.getRoster().get(0).getPosition());
            assertEquals(50, match.getCurrency().balance(0));
            assertTrue(match.getProperty().record(5).orElseThrow().isOwnedBy(0));
            assertEquals(1, match.getCurrentPlayerId());
            assertTrue(result.turnEnded());
            assertEquals(TurnPhase.AWAITING_INTENT, match.getPhase());
        }

        @Test
        @DisplayName("price 150 with balance 100 should decline and leave the property unowned")
        void purchaseDeclined() {
            MatchState match = match(trading().startingBalance(100).build(), 2,
                    ScriptedRandomSource.constant(0), property(5, 150, 15));

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 5));

            assertEquals(List.of(PLAYER_MOVED, PURCHASE_DECLINED, TURN_CHANGED), types(result));
            assertFalse(match.getProperty().record(5).orElseThrow().isOwned());
            assertEquals(100, match.getCurrency().balance(0));
        }

        @Test
        @DisplayName("rent 50 with balance 30 should bankrupt the lander and release their properties")
        void rentBankruptcy() {
            MatchState match = match(trading().startingBalance(500).build(), 3,
                    ScriptedRandomSource.constant(0), property(5, 200, 50), property(9, 100, 10));
            match.getProperty().purchase(0, 5);
            match.getProperty().purchase(1, 9);
            match.getRoster().get(1).setBalance(30);
            match.setCurrentPlayerId(1);

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(1, 5));

            assertEquals(List.of(PLAYER_MOVED, PLAYER_BANKRUPT, PROPERTY_RELEASED, PLAYER_ELIMINATED, TURN_CHANGED),
                    types(result));
            assertFalse(match.getRoster().get(1).isActive());
            assertFalse(match.getProperty().record(9).orElseThrow().isOwned());
            assertTrue(match.getRoster().get(1).getOwnedPositions().isEmpty());
            assertEquals(2, match.getCurrentPlayerId());
            assertFalse(result.matchOver());
        }

        @Test
        @DisplayName("bankrupting the only opponent should end the match")
        void bankruptcyEndsTwoPlayerMatch() {
            MatchState match = match(trading().startingBalance(500).build(), 2,
                    ScriptedRandomSource.constant(0), property(5, 200, 50));
            match.getProperty().purchase(0, 5);
            match.getRoster().get(1).setBalance(30);
            match.setCurrentPlayerId(1);

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(1, 5));

            assertTrue(result.matchOver());
            assertEquals(MATCH_OVER, types(result).get(types(result).size() - 1));
            assertEquals(0, match.getWinnerId());
            assertEquals(MatchStatus.FINISHED, match.getStatus());
            assertEquals(TurnPhase.MATCH_OVER, match.getPhase());
            assertNotNull(match.getEndedAt());
        }

        @Test
        @DisplayName("landing on a 10x10 grid combat space should apply environment damage once")
        void gridEnvironmentDamageOnce() {
            MatchState match = match(gridCombat(), 2, new ScriptedRandomSource(3));

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 14));

            assertEquals(List.of(PLAYER_MOVED, COMBAT_DAMAGE, TURN_CHANGED), types(result));
            assertEquals(92, match.getCombat().record(0).getHealth());
            assertEquals(100, match.getCombat().record(1).getHealth());
        }

        @Test
        @DisplayName("combat elimination should release the loser's properties in the same step")
        void combatEliminationReleasesProperties() {
            MatchState match = match(trading().combatEnabled(true).startingBalance(500).build(), 3,
                    ScriptedRandomSource.constant(0), property(9, 100, 10));
            match.getProperty().purchase(1, 9);
            match.getCombat().applyDamage(CombatOutcome.Trigger.ENVIRONMENT, null, 1, 95);
            match.getRoster().get(1).setPosition(8);

            // player 0 lands on 7; player 1 on 8 is nearest and takes at least 10 damage
            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 7));

            assertTrue(types(result).containsAll(List.of(COMBAT_DAMAGE, PLAYER_ELIMINATED, PROPERTY_RELEASED)));
            assertFalse(match.getRoster().get(1).isActive());
            assertFalse(match.getProperty().record(9).orElseThrow().isOwned());
            assertEquals(2, match.getCurrentPlayerId(), "Eliminated player 1 should be skipped");
        }
    }

    @Nested
    @DisplayName("passing start")
    class PassStartTests {

        @Test
        @DisplayName("a wrapping move without currency should still report passing start")
        void passedStartWithoutCurrency() {
            MatchState match = match(race().winCondition(WinCondition.ELIMINATION).build(), 2,
                    ScriptedRandomSource.constant(0));
            match.getRoster().get(0).setPosition(15);

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 10));

            assertEquals(List.of(PLAYER_MOVED, PASSED_START, TURN_CHANGED), types(result));
            MatchEvent passed = result.events().get(1);
            assertEquals(0, passed.getAmount());
            assertNull(passed.getResultingValue());
            assertEquals(5, match.getRoster().get(0).getPosition());
        }

        @Test
        @DisplayName("a zero pass bonus should report passing start with nothing paid")
        void zeroPassBonus() {
            MatchState match = match(RuleConfiguration.builder().passBonus(0).build(), 2,
                    ScriptedRandomSource.constant(0));
            match.getRoster().get(0).setPosition(18);

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 4));

            assertEquals(List.of(PLAYER_MOVED, PASSED_START, TURN_CHANGED), types(result));
            assertEquals(0, result.events().get(1).getAmount());
            assertEquals(1500, result.events().get(1).getResultingValue());
        }

        @Test
        @DisplayName("a move that does not wrap should not report passing start")
        void noWrap() {
            MatchState match = match(race().winCondition(WinCondition.ELIMINATION).build(), 2,
                    ScriptedRandomSource.constant(0));

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 19));

            assertEquals(List.of(PLAYER_MOVED, TURN_CHANGED), types(result));
        }
    }

    @Nested
    @DisplayName("trade offers")
    class TradeOfferTests {

        private MatchState match;

        @BeforeEach
        void createMatch() {
            match = match(trading().startingBalance(500).build(), 3,
                    ScriptedRandomSource.constant(0), property(5, 150, 15), property(9, 400, 40));
            match.getProperty().purchase(0, 5);
            match.getProperty().purchase(1, 9);
        }

        @Test
        @DisplayName("an offer should change nothing until the counterparty accepts it")
        void offerThenAccept() {
            IntentResult offered = turnResolver.resolveIntent(match, PlayerIntent.trade(0, 0, 1, 5, 100));

            assertEquals(List.of(TRADE_PROPOSED), types(offered));
            assertTrue(match.getProperty().record(5).orElseThrow().isOwnedBy(0));
            assertEquals(350, match.getCurrency().balance(0));
            assertNotNull(match.getPendingTrade());

            IntentResult accepted = turnResolver.resolveIntent(match, PlayerIntent.acceptTrade(1));

            assertEquals(List.of(PROPERTY_TRADED), types(accepted));
            assertFalse(accepted.turnEnded());
            assertTrue(match.getProperty().record(5).orElseThrow().isOwnedBy(1));
            assertEquals(450, match.getCurrency().balance(0));
            assertEquals(0, match.getCurrency().balance(1));
            assertNull(match.getPendingTrade());
            assertEquals(0, match.getCurrentPlayerId());
        }

        @Test
        @DisplayName("asking for an opponent's property should not take it without consent")
        void requestNeedsConsent() {
            turnResolver.resolveIntent(match, PlayerIntent.trade(0, 1, 0, 9, 0));

            assertTrue(match.getProperty().record(9).orElseThrow().isOwnedBy(1));

            IntentResult rejected = turnResolver.resolveIntent(match, PlayerIntent.rejectTrade(1));

            assertEquals(List.of(TRADE_REJECTED), types(rejected));
            assertTrue(match.getProperty().record(9).orElseThrow().isOwnedBy(1));
            assertEquals(350, match.getCurrency().balance(0));
            assertEquals(100, match.getCurrency().balance(1));
            assertNull(match.getPendingTrade());
        }

        @Test
        @DisplayName("only the counterparty should be able to answer an offer")
        void onlyCounterpartyAnswers() {
            turnResolver.resolveIntent(match, PlayerIntent.trade(0, 0, 1, 5, 100));

            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.acceptTrade(0));
            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.acceptTrade(2));
            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.rejectTrade(2));
            assertTrue(match.getProperty().record(5).orElseThrow().isOwnedBy(0));
        }

        @Test
        @DisplayName("answering without an open offer should be rejected")
        void noOpenOffer() {
            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.acceptTrade(1));
            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.cancelTrade(0));
        }

        @Test
        @DisplayName("a second offer while one is open should be rejected")
        void oneOfferAtATime() {
            turnResolver.resolveIntent(match, PlayerIntent.trade(0, 0, 1, 5, 100));

            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.trade(0, 0, 2, 5, 50));
        }

        @Test
        @DisplayName("an offer the buyer cannot pay for should be rejected up front")
        void unaffordableOffer() {
            assertRejected(RejectionReason.INSUFFICIENT_FUNDS, match, PlayerIntent.trade(0, 0, 1, 5, 101));
            assertRejected(RejectionReason.INVALID_TARGET, match, PlayerIntent.trade(0, 0, 1, 9, 10));
            assertNull(match.getPendingTrade());
        }

        @Test
        @DisplayName("the proposer should be able to withdraw the offer")
        void cancel() {
            turnResolver.resolveIntent(match, PlayerIntent.trade(0, 0, 2, 5, 100));

            IntentResult cancelled = turnResolver.resolveIntent(match, PlayerIntent.cancelTrade(0));

            assertEquals(List.of(TRADE_CANCELLED), types(cancelled));
            assertNull(match.getPendingTrade());
            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.acceptTrade(2));
        }

        @Test
        @DisplayName("an open offer should lapse when the turn passes")
        void lapsesOnTurnChange() {
            turnResolver.resolveIntent(match, PlayerIntent.trade(0, 0, 2, 5, 100));

            IntentResult moved = turnResolver.resolveIntent(match, PlayerIntent.move(0, 1));

            assertEquals(List.of(PLAYER_MOVED, TRADE_CANCELLED, TURN_CHANGED), types(moved));
            assertNull(match.getPendingTrade());
            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.acceptTrade(2));
        }

        @Test
        @DisplayName("an accepted offer that can no longer be paid should stay open and change nothing")
        void acceptRechecksFunds() {
            turnResolver.resolveIntent(match, PlayerIntent.trade(0, 0, 2, 5, 400));
            match.getCurrency().debit(2, 200);

            assertRejected(RejectionReason.INSUFFICIENT_FUNDS, match, PlayerIntent.acceptTrade(2));

            assertTrue(match.getProperty().record(5).orElseThrow().isOwnedBy(0));
            assertEquals(300, match.getCurrency().balance(2));
            assertNotNull(match.getPendingTrade());
            assertEquals(TurnPhase.AWAITING_INTENT, match.getPhase());
        }
    }

    @Nested
    @DisplayName("ROLL")
    class RollTests {

        @Test
        @DisplayName("doubles should let the same player roll again when the rule is on")
        void doublesGrantExtraTurn() {
            RuleConfiguration rules = race()
                    .diceCount(2)
                    .duplicatesGrantExtraTurn(true)
                    .duplicatesRequired(2)
                    .build();
            MatchState match = match(rules, 2, new ScriptedRandomSource(2, 2, 0, 1));

            IntentResult first = turnResolver.resolveIntent(match, PlayerIntent.roll(0));

            assertEquals(List.of(DICE_ROLLED, PLAYER_MOVED), types(first));
            assertEquals(List.of(3, 3), first.events().get(0).getValues());
            assertEquals(6, match.getRoster().get(0).getPosition());
            assertFalse(first.turnEnded());
            assertEquals(0, match.getCurrentPlayerId());

            IntentResult second = turnResolver.resolveIntent(match, PlayerIntent.roll(0));

            assertTrue(second.turnEnded());
            assertEquals(9, match.getRoster().get(0).getPosition());
            assertEquals(1, match.getCurrentPlayerId());
        }
    }

    @Nested
    @DisplayName("PURCHASE / TRADE / ATTACK")
    class ExplicitIntentTests {

        @Test
        @DisplayName("purchase should buy the current space without ending the turn")
        void purchaseKeepsTurn() {
            MatchState match = match(trading().startingBalance(500).build(), 2,
                    ScriptedRandomSource.constant(0), property(5, 150, 15));
            match.getRoster().get(0).setPosition(5);

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.purchase(0));

            assertEquals(List.of(PROPERTY_PURCHASED), types(result));
            assertFalse(result.turnEnded());
            assertEquals(0, match.getCurrentPlayerId());
            assertEquals(350, match.getCurrency().balance(0));
        }

        @Test
        @DisplayName("attack that eliminates the last opponent should end the match")
        void attackEndsMatch() {
            MatchState match = match(race().combatEnabled(true).build(), 2, ScriptedRandomSource.constant(0));
            match.getCombat().applyDamage(CombatOutcome.Trigger.ENVIRONMENT, null, 1, 90);

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.attack(0, 1));

            assertEquals(List.of(COMBAT_DAMAGE, PLAYER_ELIMINATED, MATCH_OVER), types(result));
            assertEquals(0, match.getWinnerId());
            assertTrue(match.isOver());
        }

        @Test
        @DisplayName("attack that does not eliminate should end the turn")
        void attackEndsTurn() {
            MatchState match = match(race().combatEnabled(true).build(), 2, ScriptedRandomSource.constant(0));

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.attack(0, 1));

            assertEquals(List.of(COMBAT_DAMAGE, TURN_CHANGED), types(result));
            assertEquals(85, match.getCombat().record(1).getHealth());
            assertEquals(1, match.getCurrentPlayerId());
        }
    }

    @Nested
    @DisplayName("rejections")
    class RejectionTests {

        @Test
        @DisplayName("should reject a player acting out of turn")
        void outOfTurn() {
            MatchState match = match(race().build(), 2, ScriptedRandomSource.constant(0));

            assertRejected(RejectionReason.OUT_OF_TURN, match, PlayerIntent.move(1, 3));
            assertEquals(0, match.getRoster().get(1).getPosition());
        }

        @Test
        @DisplayName("should reject an unknown player")
        void unknownPlayer() {
            MatchState match = match(race().build(), 2, ScriptedRandomSource.constant(0));

            assertRejected(RejectionReason.UNKNOWN_PLAYER, match, PlayerIntent.move(7, 3));
        }

        @Test
        @DisplayName("should reject any intent once the match is over")
        void matchOver() {
            MatchState match = match(race().build(), 2, ScriptedRandomSource.constant(0));
            match.setStatus(MatchStatus.FINISHED);
            match.setPhase(TurnPhase.MATCH_OVER);

            assertRejected(RejectionReason.MATCH_OVER, match, PlayerIntent.move(0, 3));
        }

        @Test
        @DisplayName("should reject intents for modules that are not active")
        void featureDisabled() {
            MatchState trading = match(trading().build(), 2, ScriptedRandomSource.constant(0));
            MatchState race = match(race().build(), 2, ScriptedRandomSource.constant(0));

            assertRejected(RejectionReason.FEATURE_DISABLED, trading, PlayerIntent.attack(0, 1));
            assertRejected(RejectionReason.FEATURE_DISABLED, race, PlayerIntent.purchase(0));
            assertRejected(RejectionReason.FEATURE_DISABLED, race, PlayerIntent.trade(0, 0, 1, 5, 10));
        }

        @Test
        @DisplayName("should reject malformed intents")
        void invalidIntent() {
            MatchState match = match(trading().build(), 3, ScriptedRandomSource.constant(0));

            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.move(0, -2));
            assertRejected(RejectionReason.INVALID_INTENT, match, PlayerIntent.trade(0, 1, 2, 5, 10));
        }

        @Test
        @DisplayName("short funds for an explicit purchase should leave everything unchanged")
        void insufficientFunds() {
            MatchState match = match(trading().startingBalance(100).build(), 2,
                    ScriptedRandomSource.constant(0), property(5, 150, 15));
            match.getRoster().get(0).setPosition(5);

            assertRejected(RejectionReason.INSUFFICIENT_FUNDS, match, PlayerIntent.purchase(0));
            assertEquals(100, match.getCurrency().balance(0));
            assertFalse(match.getProperty().record(5).orElseThrow().isOwned());
            assertEquals(TurnPhase.AWAITING_INTENT, match.getPhase());
        }

        @Test
        @DisplayName("attacking oneself should be an invalid target")
        void invalidTarget() {
            MatchState match = match(race().combatEnabled(true).build(), 2, ScriptedRandomSource.constant(0));

            assertRejected(RejectionReason.INVALID_TARGET, match, PlayerIntent.attack(0, 0));
            assertEquals(100, match.getCombat().record(0).getHealth());
        }
    }

    @Nested
    @DisplayName("turn advance and win conditions")
    class TurnAndWinTests {

        @Test
        @DisplayName("turn number should increase when the turn wraps to the first player")
        void turnNumberOnWrap() {
            MatchState match = match(race().build(), 2, ScriptedRandomSource.constant(0));

            turnResolver.resolveIntent(match, PlayerIntent.move(0, 1));
            assertEquals(1, match.getTurnNumber());

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(1, 1));

            assertEquals(0, match.getCurrentPlayerId());
            assertEquals(2, match.getTurnNumber());
            MatchEvent changed = result.events().get(result.events().size() - 1);
            assertEquals(TURN_CHANGED, changed.getType());
            assertEquals(2, changed.getResultingValue());
        }

        @Test
        @DisplayName("inactive players should be skipped")
        void skipsInactive() {
            MatchState match = match(race().build(), 3, ScriptedRandomSource.constant(0));
            match.getRoster().get(1).deactivate();

            turnResolver.resolveIntent(match, PlayerIntent.move(0, 1));

            assertEquals(2, match.getCurrentPlayerId());
        }

        @Test
        @DisplayName("landing on the goal should win a race")
        void reachGoal() {
            MatchState match = match(race().build(), 2, ScriptedRandomSource.constant(0));
            match.getRoster().get(0).setPosition(15);

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 4));

            assertEquals(List.of(PLAYER_MOVED, MATCH_OVER), types(result));
            assertEquals(0, match.getWinnerId());
        }

        @Test
        @DisplayName("reaching the winning balance should win")
        void balanceThreshold() {
            RuleConfiguration rules = RuleConfiguration.builder()
                    .startingBalance(900)
                    .passBonus(200)
                    .winCondition(WinCondition.BALANCE_THRESHOLD)
                    .winningBalance(1000)
                    .build();
            MatchState match = match(rules, 2, ScriptedRandomSource.constant(0));
            match.getRoster().get(0).setPosition(18);

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 3));

            assertEquals(List.of(PLAYER_MOVED, PASSED_START, MATCH_OVER), types(result));
            assertEquals(0, match.getWinnerId());
            assertEquals(1100, match.getCurrency().balance(0));
        }

        @Test
        @DisplayName("a solo match should not end just because one player is active")
        void soloMatchContinues() {
            MatchState match = match(race().minPlayers(1).build(), 1, ScriptedRandomSource.constant(0));

            IntentResult result = turnResolver.resolveIntent(match, PlayerIntent.move(0, 2));

            assertFalse(result.matchOver());
            assertEquals(0, match.getCurrentPlayerId());
            assertEquals(2, match.getTurnNumber());
        }
    }
}
