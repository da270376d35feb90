package com.tabletop.module;

import com.tabletop.model.RuleConfiguration;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolls the dice described by the rule configuration.
 */
public class DiceRoller {

    private final RuleConfiguration rules;
    private final RandomSource random;

    public DiceRoller(RuleConfiguration rules, RandomSource random) {
        this.rules = rules;
        this.random = random;
    }

    public DiceRoll roll() {
        List<Integer> faces = new ArrayList<>(rules.getDiceCount());
        for (int i = 0; i < rules.getDiceCount(); i++) {
            faces.add(random.nextInt(rules.getDiceSides()) + 1);
        }
        return new DiceRoll(faces);
    }

    public boolean grantsExtraTurn(DiceRoll roll) {
        return rules.isDuplicatesGrantExtraTurn() && roll.hasDuplicates(rules.getDuplicatesRequired());
    }
}
