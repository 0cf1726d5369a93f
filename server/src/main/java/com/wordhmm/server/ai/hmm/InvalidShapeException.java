package com.wordhmm.server.ai.hmm;

/**
 * Thrown when model parameters do not match the number of states.
 */
public class InvalidShapeException extends HmmException {

    public InvalidShapeException(String message) {
        super(message);
    }
}
