package com.tabletop.exception;

import lombok.Getter;

import java.util.List;

/**
 * The rule configuration contradicts itself; no match can be created from it.
 */
@Getter
public class RuleConfigurationException extends RuntimeException {

    private final List<String> conflicts;

    public RuleConfigurationException(List<String> conflicts) {
        super("Invalid rule configuration: " + String.join("; ", conflicts));
        this.conflicts = List.copyOf(conflicts);
    }
}
