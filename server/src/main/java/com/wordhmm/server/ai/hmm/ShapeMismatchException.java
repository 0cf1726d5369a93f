package com.wordhmm.server.ai.hmm;

/**
 * Thrown when a state label does not index into the supplied emission rows.
 */
public class ShapeMismatchException extends HmmException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
