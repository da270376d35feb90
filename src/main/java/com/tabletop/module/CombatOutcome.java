package com.tabletop.module;

import lombok.Builder;
import lombok.Value;

/**
 * One application of damage.
 */
@Value
@Builder
public class CombatOutcome {

    public enum Trigger {
        ENVIRONMENT,    // Encounter on separate boards
        LANDING,        // Landing on a combat space hits the nearest opponent
        ATTACK          // Explicit attack intent
    }

    Trigger trigger;
    /** Null for environment encounters. */
    Integer attackerId;
    int targetId;
    int damage;
    int healthAfter;
    boolean eliminated;
}
