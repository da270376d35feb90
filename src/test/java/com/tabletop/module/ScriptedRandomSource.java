package com.tabletop.module;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Deterministic {@link RandomSource} for tests: hands out scripted values in order, then the fallback.
 */
public class ScriptedRandomSource implements RandomSource {

    private final Deque<Integer> values = new ArrayDeque<>();
    private final int fallback;

    public ScriptedRandomSource(int... values) {
        this(0, values);
    }

    public static ScriptedRandomSource constant(int value) {
        return new ScriptedRandomSource(value, new int[0]);
    }

    private ScriptedRandomSource(int fallback, int... values) {
        this.fallback = fallback;
        for (int value : values) {
            this.values.add(value);
        }
    }

    public ScriptedRandomSource then(int... more) {
        for (int value : more) {
            values.add(value);
        }
        return this;
    }

    @Override
    public int nextInt(int bound) {
        int value = values.isEmpty() ? fallback : values.poll();
        return Math.floorMod(value, bound);
    }
}
