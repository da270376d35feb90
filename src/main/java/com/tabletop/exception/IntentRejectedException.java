package com.tabletop.exception;

import lombok.Getter;

/**
 * Thrown when an intent cannot be applied. Thrown before any state is touched.
 */
@Getter
public class IntentRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public IntentRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
