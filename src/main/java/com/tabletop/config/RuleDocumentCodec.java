package com.tabletop.config;

import com.tabletop.model.RuleConfiguration;
import com.tabletop.model.WinCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts a {@link RuleConfiguration} to and from a flat key/value document.
 * <p>
 * Keys are grouped by concern, e.g. {@code currency.startingBalance}. Reading is lenient:
 * missing keys take their defaults and unknown keys are ignored, so documents written by older
 * versions load without migration. A present key with a value of the wrong type is an error.
 */
@Component
@Slf4j
public class RuleDocumentCodec {

    public static final int SCHEMA_VERSION = 1;
    public static final String SCHEMA_VERSION_KEY = "schemaVersion";

    static final String CURRENCY_ENABLED = "currency.enabled";
    static final String CURRENCY_STARTING_BALANCE = "currency.startingBalance";
    static final String CURRENCY_PASS_BONUS = "currency.passBonus";
    static final String BOARD_SEPARATE = "board.separateBoards";
    static final String BOARD_TILES_PER_SIDE = "board.tilesPerSide";
    static final String PROPERTY_PURCHASABLE = "property.purchasable";
    static final String PROPERTY_TRADABLE = "property.tradable";
    static final String PROPERTY_RENT = "property.rentCollectible";
    static final String PROPERTY_BANKRUPTCY = "property.bankruptcyEnabled";
    static final String COMBAT_ENABLED = "combat.enabled";
    static final String COMBAT_SHIP_PLACEMENT = "combat.shipPlacement";
    static final String VISIBILITY_ENEMY_TOKENS = "visibility.enemyTokensVisible";
    static final String VISIBILITY_RANGE = "visibility.enemyRange";
    static final String PLAYERS_MIN = "players.min";
    static final String PLAYERS_MAX = "players.max";
    static final String WIN_CONDITION = "win.condition";
    static final String WIN_BALANCE = "win.winningBalance";
    static final String DICE_COUNT = "dice.count";
    static final String DICE_SIDES = "dice.sides";
    static final String DICE_DUPLICATES_EXTRA_TURN = "dice.duplicatesGrantExtraTurn";
    static final String DICE_DUPLICATES_REQUIRED = "dice.duplicatesRequired";
    static final String RESOURCES_ENABLED = "resources.enabled";
    static final String RESOURCES_COUNT = "resources.count";
    static final String RESOURCES_NAMES = "resources.names";
    static final String RESOURCES_CAP_ENABLED = "resources.capEnabled";
    static final String RESOURCES_MAX_PER_TYPE = "resources.maxPerType";

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RuleDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> toDocument(RuleConfiguration rules) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(SCHEMA_VERSION_KEY, SCHEMA_VERSION);

        doc.put(CURRENCY_ENABLED, rules.isCurrencyEnabled());
        doc.put(CURRENCY_STARTING_BALANCE, rules.getStartingBalance());
        doc.put(CURRENCY_PASS_BONUS, rules.getPassBonus());

        doc.put(BOARD_SEPARATE, rules.isSeparateBoards());
        doc.put(BOARD_TILES_PER_SIDE, rules.getTilesPerSide());

        doc.put(PROPERTY_PURCHASABLE, rules.isPurchasableProperties());
        doc.put(PROPERTY_TRADABLE, rules.isTradableProperties());
        doc.put(PROPERTY_RENT, rules.isRentCollectible());
        doc.put(PROPERTY_BANKRUPTCY, rules.isBankruptcyEnabled());

        doc.put(COMBAT_ENABLED, rules.isCombatEnabled());
        doc.put(COMBAT_SHIP_PLACEMENT, rules.isShipPlacement());

        doc.put(VISIBILITY_ENEMY_TOKENS, rules.isEnemyTokensVisible());
        doc.put(VISIBILITY_RANGE, rules.getEnemyVisibilityRange());

        doc.put(PLAYERS_MIN, rules.getMinPlayers());
        doc.put(PLAYERS_MAX, rules.getMaxPlayers());

        doc.put(WIN_CONDITION, rules.getWinCondition().name());
        doc.put(WIN_BALANCE, rules.getWinningBalance());

        doc.put(DICE_COUNT, rules.getDiceCount());
        doc.put(DICE_SIDES, rules.getDiceSides());
        doc.put(DICE_DUPLICATES_EXTRA_TURN, rules.isDuplicatesGrantExtraTurn());
        doc.put(DICE_DUPLICATES_REQUIRED, rules.getDuplicatesRequired());

        doc.put(RESOURCES_ENABLED, rules.isResourcesEnabled());
        doc.put(RESOURCES_COUNT, rules.getResourceCount());
        doc.put(RESOURCES_NAMES, new ArrayList<>(rules.getResourceNames()));
        doc.put(RESOURCES_CAP_ENABLED, rules.isResourceCapEnabled());
        doc.put(RESOURCES_MAX_PER_TYPE, rules.getMaxResourcesPerType());
        return doc;
    }

    /**
     * Read a rule configuration from a flat document.
     *
     * @throws IllegalArgumentException if a present key holds a value of the wrong type
     */
    public RuleConfiguration fromDocument(Map<String, ?> doc) {
        int version = readInt(doc, SCHEMA_VERSION_KEY, SCHEMA_VERSION);
        if (version > SCHEMA_VERSION) {
            log.warn("Rule document has schema version {} (newer than {}); unknown keys are ignored",
                    version, SCHEMA_VERSION);
        }

        RuleConfiguration defaults = RuleConfiguration.defaults();
        return RuleConfiguration.builder()
                .currencyEnabled(readBoolean(doc, CURRENCY_ENABLED, defaults.isCurrencyEnabled()))
                .startingBalance(readInt(doc, CURRENCY_STARTING_BALANCE, defaults.getStartingBalance()))
                .passBonus(readInt(doc, CURRENCY_PASS_BONUS, defaults.getPassBonus()))
                .separateBoards(readBoolean(doc, BOARD_SEPARATE, defaults.isSeparateBoards()))
                .tilesPerSide(readInt(doc, BOARD_TILES_PER_SIDE, defaults.getTilesPerSide()))
                .purchasableProperties(readBoolean(doc, PROPERTY_PURCHASABLE, defaults.isPurchasableProperties()))
                .tradableProperties(readBoolean(doc, PROPERTY_TRADABLE, defaults.isTradableProperties()))
                .rentCollectible(readBoolean(doc, PROPERTY_RENT, defaults.isRentCollectible()))
                .bankruptcyEnabled(readBoolean(doc, PROPERTY_BANKRUPTCY, defaults.isBankruptcyEnabled()))
                .combatEnabled(readBoolean(doc, COMBAT_ENABLED, defaults.isCombatEnabled()))
                .shipPlacement(readBoolean(doc, COMBAT_SHIP_PLACEMENT, defaults.isShipPlacement()))
                .enemyTokensVisible(readBoolean(doc, VISIBILITY_ENEMY_TOKENS, defaults.isEnemyTokensVisible()))
                .enemyVisibilityRange(readInt(doc, VISIBILITY_RANGE, defaults.getEnemyVisibilityRange()))
                .minPlayers(readInt(doc, PLAYERS_MIN, defaults.getMinPlayers()))
                .maxPlayers(readInt(doc, PLAYERS_MAX, defaults.getMaxPlayers()))
                .winCondition(readWinCondition(doc, defaults.getWinCondition()))
                .winningBalance(readInt(doc, WIN_BALANCE, defaults.getWinningBalance()))
                .diceCount(readInt(doc, DICE_COUNT, defaults.getDiceCount()))
                .diceSides(readInt(doc, DICE_SIDES, defaults.getDiceSides()))
                .duplicatesGrantExtraTurn(readBoolean(doc, DICE_DUPLICATES_EXTRA_TURN, defaults.isDuplicatesGrantExtraTurn()))
                .duplicatesRequired(readInt(doc, DICE_DUPLICATES_REQUIRED, defaults.getDuplicatesRequired()))
                .resourcesEnabled(readBoolean(doc, RESOURCES_ENABLED, defaults.isResourcesEnabled()))
                .resourceCount(readInt(doc, RESOURCES_COUNT, defaults.getResourceCount()))
                .resourceNames(readStrings(doc, RESOURCES_NAMES, defaults.getResourceNames()))
                .resourceCapEnabled(readBoolean(doc, RESOURCES_CAP_ENABLED, defaults.isResourceCapEnabled()))
                .maxResourcesPerType(readInt(doc, RESOURCES_MAX_PER_TYPE, defaults.getMaxResourcesPerType()))
                .build();
    }

    public String toJson(RuleConfiguration rules) {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(rules));
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON object or holds a mistyped value
     */
    public RuleConfiguration fromJson(String json) {
        Map<String, Object> doc;
        try {
            doc = objectMapper.readValue(json, DOCUMENT_TYPE);
        } catch (JacksonException e) {
            throw new IllegalArgumentException("Rule document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (doc == null) {
            throw new IllegalArgumentException("Rule document is empty");
        }
        return fromDocument(doc);
    }

    // ── value readers ───────────────────────────────────────────────────

    private static int readInt(Map<String, ?> doc, String key, int fallback) {
        Object value = doc.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                // fractional or outside the int range
                throw invalid(key, value, e);
            }
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, e);
            }
        }
        throw invalid(key, value, null);
    }

    private static boolean readBoolean(Map<String, ?> doc, String key, boolean fallback) {
        Object value = doc.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("false")) {
                return Boolean.parseBoolean(normalized);
            }
        }
        throw invalid(key, value, null);
    }

    private static WinCondition readWinCondition(Map<String, ?> doc, WinCondition fallback) {
        Object value = doc.get(WIN_CONDITION);
        if (value == null) {
            return fallback;
        }
        try {
            return WinCondition.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw invalid(WIN_CONDITION, value, e);
        }
    }

    private static List<String> readStrings(Map<String, ?> doc, String key, List<String> fallback) {
        Object value = doc.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof List<?> items) {
            List<String> names = new ArrayList<>(items.size());
            for (Object item : items) {
                names.add(item == null ? null : item.toString());
            }
            return names;
        }
        if (value instanceof String text) {
            if (text.isBlank()) {
                return List.of();
            }
            List<String> names = new ArrayList<>();
            for (String part : text.split(",")) {
                names.add(part.trim());
            }
            return names;
        }
        throw invalid(key, value, null);
    }

    private static IllegalArgumentException invalid(String key, Object value, Exception cause) {
        return new IllegalArgumentException("Invalid value for '" + key + "': " + value, cause);
    }
}
