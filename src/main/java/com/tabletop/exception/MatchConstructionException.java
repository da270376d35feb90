package com.tabletop.exception;

/**
 * A required module could not be wired. Fatal to match creation.
 */
public class MatchConstructionException extends RuntimeException {

    public MatchConstructionException(String message) {
        super(message);
    }
}
