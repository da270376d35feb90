package com.tabletop.config;

import com.tabletop.module.RandomSource;

/**
 * Inclusive damage bounds for one kind of combat trigger.
 */
public record DamageRange(int min, int max) {

    public DamageRange {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid damage range [" + min + ", " + max + "]");
        }
    }

    public int roll(RandomSource random) {
        return min + random.nextInt(max - min + 1);
    }

    public boolean contains(int damage) {
        return damage >= min && damage <= max;
    }
}
