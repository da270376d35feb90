package com.tabletop.model;

import java.util.List;

/**
 * Result of classifying a rule configuration.
 *
 * @param archetype detected game shape; always {@link Archetype#HYBRID} when invalid
 * @param valid     false when any rule contradicts another
 * @param conflicts human-readable reasons naming the conflicting fields
 */
public record RuleAnalysis(Archetype archetype, boolean valid, List<String> conflicts) {

    public RuleAnalysis {
        conflicts = List.copyOf(conflicts);
    }

    public static RuleAnalysis valid(Archetype archetype) {
        return new RuleAnalysis(archetype, true, List.of());
    }

    public static RuleAnalysis invalid(List<String> conflicts) {
        return new RuleAnalysis(Archetype.HYBRID, false, conflicts);
    }
}
