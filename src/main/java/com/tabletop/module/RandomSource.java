package com.tabletop.module;

/**
 * Source of randomness for dice, damage and property placement.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * @return a value in {@code [0, bound)}
     */
    int nextInt(int bound);
}
