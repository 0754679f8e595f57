package com.solidity.parser;

/**
 * Raised when a parse tree has a shape the reducer has no rule for, or when a sub-production the
 * reducer relies on is absent, or when the input nests deeper than the configured or available depth.
 */
public final class ReductionException extends RuntimeException {
    public ReductionException(String message) {
        super(message);
    }

    public ReductionException(String message, Throwable cause) {
        super(message, cause);
    }
}
