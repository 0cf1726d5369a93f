package com.wordhmm.server.ai;

import com.wordhmm.server.ai.hmm.WordHmm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores an utterance against every candidate word model and picks the word whose
 * model gives the highest forward log-likelihood.
 */
public class WordRecognizer {
    private static final Logger logger = LoggerFactory.getLogger(WordRecognizer.class);

    private final Map<String, WordHmm> models;

    public WordRecognizer(Map<String, WordHmm> models) {
        if (models.isEmpty()) {
            throw new IllegalArgumentException("At least one word model is required");
        }
        this.models = new LinkedHashMap<>(models);
    }

    public List<String> getWords() {
        return Collections.unmodifiableList(new ArrayList<>(models.keySet()));
    }

    public WordHmm getModel(String word) {
        WordHmm hmm = models.get(word);
        if (hmm == null) {
            throw new IllegalArgumentException("Unknown word: " + word);
        }
        return hmm;
    }

    public boolean hasWord(String word) {
        return models.containsKey(word);
    }

    public RecognitionResult recognize(double[][] emissions) {
        List<String> words = getWords();
        double[] logLikelihoods = new double[words.size()];

        double bestLogL = Double.NEGATIVE_INFINITY;
        String bestWord = null;

        for (int w = 0; w < words.size(); w++) {
            String word = words.get(w);
            double logL = score(models.get(word), emissions);
            logLikelihoods[w] = logL;

            logger.debug("Word '{}' log-likelihood = {}", word, logL);

            if (bestWord == null || logL > bestLogL) {
                bestLogL = logL;
                bestWord = word;
            }
        }

        logger.info("Recognized word: {}", bestWord);

        return new RecognitionResult(bestWord, words, logLikelihoods);
    }

    /**
     * Forward log-likelihood of every word model for every utterance.
     *
     * @return [word][utterance], words in {@link #getWords()} order
     */
    public double[][] scoreMatrix(List<double[][]> utterances) {
        List<String> words = getWords();
        double[][] matrix = new double[words.size()][utterances.size()];
        for (int w = 0; w < words.size(); w++) {
            WordHmm hmm = models.get(words.get(w));
            for (int u = 0; u < utterances.size(); u++) {
                matrix[w][u] = score(hmm, utterances.get(u));
            }
        }
        return matrix;
    }

    // Re-estimation of the same model holds this lock
    private static double score(WordHmm hmm, double[][] emissions) {
        synchronized (hmm) {
            return hmm.forward(emissions);
        }
    }

    public double evaluateAccuracy(List<LabeledUtterance> testData) {
        int correct = 0;
        int total = testData.size();

        logger.info("Evaluating accuracy on {} utterances...", total);

        for (LabeledUtterance utt : testData) {
            String predicted = recognize(utt.emissions).getPredictedWord();
            if (predicted.equals(utt.label)) {
                correct++;
            } else {
                logger.debug("Misrecognized '{}' ({}) as '{}'", utt.label, utt.utteranceId, predicted);
            }
        }

        double accuracy = total == 0 ? 0.0 : (double) correct / total;
        logger.info("Evaluation complete. Accuracy: {} ({}/{})", accuracy, correct, total);
        return accuracy;
    }
}
