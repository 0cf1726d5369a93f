package com.wordhmm.server.ai.hmm;

/**
 * Base class for precondition failures raised by {@link WordHmm} before any numeric work.
 */
public class HmmException extends IllegalArgumentException {

    public HmmException(String message) {
        super(message);
    }
}
