package com.tabletop.service;

import com.tabletop.config.CombatProperties;
import com.tabletop.config.PropertyPricingProperties;
import com.tabletop.exception.MatchConstructionException;
import com.tabletop.exception.RuleConfigurationException;
import com.tabletop.model.Archetype;
import com.tabletop.model.MatchState;
import com.tabletop.model.ModuleType;
import com.tabletop.model.PlayerRoster;
import com.tabletop.model.PropertyRecord;
import com.tabletop.model.RuleAnalysis;
import com.tabletop.model.RuleConfiguration;
import com.tabletop.module.BoardModel;
import com.tabletop.module.CombatModel;
import com.tabletop.module.CurrencyLedger;
import com.tabletop.module.DiceRoller;
import com.tabletop.module.MovementModel;
import com.tabletop.module.PropertyRegistry;
import com.tabletop.module.RandomSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Builds a fully wired {@link MatchState} from a rule configuration.
 * <p>
 * Modules are constructed in dependency order (board, currency, property, combat, movement) on
 * local variables; nothing is visible to callers until the match is complete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchComposer {

    static final int MIN_PROPERTY_ATTEMPTS = 2;

    private final RuleAnalyzer ruleAnalyzer;
    private final CombatProperties combatProperties;
    private final PropertyPricingProperties pricing;
    private final RandomSource random;

    /**
     * Compose a new match.
     *
     * @param requestedPlayers clamped into the configured player range
     * @throws RuleConfigurationException  if the rules contradict themselves
     * @throws MatchConstructionException if the archetype needs a module the rules switched off
     */
    public MatchState build(RuleConfiguration rules, int requestedPlayers) {
        RuleAnalysis analysis = ruleAnalyzer.classify(rules);
        if (!analysis.valid()) {
            throw new RuleConfigurationException(analysis.conflicts());
        }

        List<String> warnings = ruleAnalyzer.warnings(rules);
        warnings.forEach(w -> log.warn("Unusual rules: {}", w));

        Set<ModuleType> modules = requiredModules(analysis.archetype(), rules);
        int playerCount = clampPlayers(rules, requestedPlayers);

        PlayerRoster roster = new PlayerRoster();
        int startingBalance = rules.isCurrencyEnabled() ? rules.getStartingBalance() : 0;
        for (int i = 0; i < playerCount; i++) {
            roster.enlist(startingBalance);
        }

        BoardModel board = new BoardModel(rules);

        CurrencyLedger currency = null;
        if (modules.contains(ModuleType.CURRENCY)) {
            currency = new CurrencyLedger(roster);
        }

        PropertyRegistry property = null;
        if (modules.contains(ModuleType.PROPERTY)) {
            if (currency == null) {
                throw new MatchConstructionException("Property module requires Currency module");
            }
            property = new PropertyRegistry(rules, currency, roster);
            placeProperties(property, board);
        }

        CombatModel combat = null;
        if (modules.contains(ModuleType.COMBAT)) {
            combat = new CombatModel(rules, combatProperties, roster, random);
        }

        MovementModel movement = new MovementModel(board, roster, currency, rules);

        MatchState match = MatchState.builder()
                .id(UUID.randomUUID().toString())
                .rules(rules)
                .archetype(analysis.archetype())
                .roster(roster)
                .board(board)
                .movement(movement)
                .currency(currency)
                .property(property)
                .combat(combat)
                .dice(new DiceRoller(rules, random))
                .ruleWarnings(warnings)
                .build();

        log.info("Composed {} match {} for {} players on a {} board of {} spaces (modules: {})",
                analysis.archetype(), match.getId(), playerCount, board.shape(), board.size(),
                match.activeModules());
        return match;
    }

    /**
     * Modules the archetype cannot run without, plus every module an enabled rule implies.
     *
     * @throws MatchConstructionException if a mandatory module's enabling rule is off
     */
    Set<ModuleType> requiredModules(Archetype archetype, RuleConfiguration rules) {
        Set<ModuleType> modules = EnumSet.of(ModuleType.BOARD, ModuleType.MOVEMENT);

        Set<ModuleType> mandatory = switch (archetype) {
            case TRADING -> EnumSet.of(ModuleType.CURRENCY, ModuleType.PROPERTY);
            case GRID_COMBAT -> EnumSet.of(ModuleType.COMBAT);
            case RACE, HYBRID -> EnumSet.noneOf(ModuleType.class);
        };
        for (ModuleType type : mandatory) {
            if (!isEnabled(type, rules)) {
                throw new MatchConstructionException(archetype + " match requires the " + type
                        + " module but its rule is disabled");
            }
        }
        modules.addAll(mandatory);

        for (ModuleType type : ModuleType.values()) {
            if (isEnabled(type, rules)) {
                modules.add(type);
            }
        }
        return modules;
    }

    private boolean isEnabled(ModuleType type, RuleConfiguration rules) {
        return switch (type) {
            case BOARD, MOVEMENT -> true;
            case CURRENCY -> rules.isCurrencyEnabled();
            case PROPERTY -> rules.isPurchasableProperties();
            case COMBAT -> rules.isCombatEnabled();
        };
    }

    private int clampPlayers(RuleConfiguration rules, int requested) {
        int count = Math.max(rules.getMinPlayers(), Math.min(rules.getMaxPlayers(), requested));
        if (count != requested) {
            log.debug("Requested {} players, clamped to {}", requested, count);
        }
        return count;
    }

    private void placeProperties(PropertyRegistry property, BoardModel board) {
        int attempts = Math.max(MIN_PROPERTY_ATTEMPTS, board.size() / 4);
        for (int i = 0; i < attempts; i++) {
            int position = 1 + random.nextInt(board.size() - 1);
            int price = pricing.priceOf(i);
            PropertyRecord record = PropertyRecord.builder()
                    .position(position)
                    .name("Property " + (i + 1))
                    .purchasePrice(price)
                    .rentPrice(pricing.rentFor(price))
                    .build();
            if (!property.place(record)) {
                log.debug("Position {} already holds a property, skipping", position);
            }
        }
        log.debug("Placed {} properties from {} attempts", property.records().size(), attempts);
    }
}
