package com.wordhmm.server.ai;

import java.util.List;

public class RecognitionResult {
    private final String predictedWord;
    private final List<String> words;
    private final double[] logLikelihoods;

    public RecognitionResult(String predictedWord, List<String> words, double[] logLikelihoods) {
        this.predictedWord = predictedWord;
        this.words = words;
        this.logLikelihoods = logLikelihoods;
    }

    public String getPredictedWord() {
        return predictedWord;
    }

    /**
     * Candidate words, in the order of {@link #getLogLikelihoods()}.
     */
    public List<String> getWords() {
        return words;
    }

    public double[] getLogLikelihoods() {
        return logLikelihoods;
    }

    public double getLogLikelihood(String word) {
        int idx = words.indexOf(word);
        if (idx < 0) {
            throw new IllegalArgumentException("Not a candidate word: " + word);
        }
        return logLikelihoods[idx];
    }
}
