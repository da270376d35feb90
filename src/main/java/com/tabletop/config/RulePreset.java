package com.tabletop.config;

import com.tabletop.model.RuleConfiguration;

/**
 * A named rule set, loaded from a JSON rule document.
 *
 * @param id          unique slug, e.g. "trading-classic"
 * @param name        human-readable name
 * @param description short description of the variant
 * @param rules       the rule configuration the document describes
 */
public record RulePreset(
        String id,
        String name,
        String description,
        RuleConfiguration rules
) {}
