package com.tabletop.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Combat tuning, bound from {@code engine.combat}.
 *
 * @param triggerInterval   combat triggers on non-zero multiples of this position
 * @param startingHealth    health every player starts with
 * @param environmentDamage damage from an encounter on separate boards (PvE)
 * @param landingDamage     damage dealt to the nearest opponent when landing on a combat space (PvP)
 * @param attackDamage      damage dealt by an explicit attack
 */
@ConfigurationProperties(prefix = "engine.combat")
public record CombatProperties(
        int triggerInterval,
        int startingHealth,
        DamageRange environmentDamage,
        DamageRange landingDamage,
        DamageRange attackDamage
) {

    public CombatProperties {
        if (triggerInterval <= 0) {
            triggerInterval = 7;
        }
        if (startingHealth <= 0) {
            startingHealth = 100;
        }
        if (environmentDamage == null) {
            environmentDamage = new DamageRange(5, 19);
        }
        if (landingDamage == null) {
            landingDamage = new DamageRange(10, 29);
        }
        if (attackDamage == null) {
            attackDamage = new DamageRange(15, 34);
        }
    }

    public static CombatProperties defaults() {
        return new CombatProperties(0, 0, null, null, null);
    }
}
