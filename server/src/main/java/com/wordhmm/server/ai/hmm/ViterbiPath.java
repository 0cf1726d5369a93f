package com.wordhmm.server.ai.hmm;

import java.util.Arrays;

/**
 * Most likely state sequence of a word model for one utterance.
 */
public class ViterbiPath {
    private final int[] states;
    private final double logScore;

    public ViterbiPath(int[] states, double logScore) {
        this.states = states.clone();
        this.logScore = logScore;
    }

    public int[] getStates() {
        return states.clone();
    }

    /**
     * Joint log probability of the best path and the observations, delta[T-1][path[T-1]].
     */
    public double getLogScore() {
        return logScore;
    }

    public int length() {
        return states.length;
    }

    @Override
    public String toString() {
        return "ViterbiPath{states=" + Arrays.toString(states) + ", logScore=" + logScore + "}";
    }
}
