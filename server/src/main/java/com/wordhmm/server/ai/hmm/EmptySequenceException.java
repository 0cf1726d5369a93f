package com.wordhmm.server.ai.hmm;

public class EmptySequenceException extends HmmException {

    public EmptySequenceException() {
        super("Emission sequence must contain at least one frame");
    }
}
