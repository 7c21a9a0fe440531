package com.jsanalyzer.analyze.syntax;

/**
 * Thrown when a {@link BatchMutation} cannot be committed. The tree it was started from is
 * left untouched.
 */
public class MutationException extends RuntimeException {
    public MutationException(String message) {
        super(message);
    }

    public MutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
