package com.wordhmm.server.ai;

import com.wordhmm.server.ai.emission.PhoneInventory;
import com.wordhmm.server.ai.hmm.WordHmm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds word models from configuration.
 */
public class WordModelFactory {

    private static final Logger logger = LoggerFactory.getLogger(WordModelFactory.class);
    private static final double DEFAULT_SELF_LOOP = 0.9;

    private final PhoneInventory inventory;
    private final double epsilon;

    public WordModelFactory(PhoneInventory inventory, double epsilon) {
        this.inventory = inventory;
        this.epsilon = epsilon;
    }

    public static WordModelFactory fromConfig(WordModelConfig.ConfigRoot config) {
        if (config.phoneInventory == null || config.phoneInventory.isEmpty()) {
            throw new IllegalArgumentException("Configuration has no phoneInventory");
        }
        double eps = config.epsilon != null ? config.epsilon : WordHmm.DEFAULT_EPSILON;
        return new WordModelFactory(new PhoneInventory(config.phoneInventory), eps);
    }

    public PhoneInventory getInventory() {
        return inventory;
    }

    public Map<String, WordHmm> buildAll(WordModelConfig.ConfigRoot config) {
        Map<String, WordHmm> models = new LinkedHashMap<>();
        if (config.words == null) {
            logger.warn("Configuration defines no words");
            return models;
        }
        for (WordModelConfig.WordNode node : config.words) {
            if (models.containsKey(node.word)) {
                throw new IllegalArgumentException("Duplicate word model: " + node.word);
            }
            models.put(node.word, build(node));
        }
        logger.info("Built {} word models over a {}-phone inventory", models.size(), inventory.size());
        return models;
    }

    public WordHmm build(WordModelConfig.WordNode node) {
        if (node.word == null || node.phones == null || node.phones.isEmpty()) {
            throw new IllegalArgumentException("Word node needs a word and a phone sequence");
        }
        int[] labels = inventory.indicesOf(node.phones);
        int n = labels.length;

        double selfLoop = node.selfLoop != null ? node.selfLoop : DEFAULT_SELF_LOOP;
        double[] initial = node.initial != null ? node.initial : leftToRightInitial(n);
        double[][] transitions = node.transitions != null ? node.transitions : leftToRightTransitions(n, selfLoop);

        logger.debug("Word '{}': phones={}, states={}", node.word, node.phones, n);
        return new WordHmm(labels, initial, transitions, epsilon);
    }

    /**
     * Initial mass split evenly between the first two states (all of it on state 0
     * for a one-state model).
     */
    public static double[] leftToRightInitial(int numStates) {
        double[] initial = new double[numStates];
        if (numStates == 1) {
            initial[0] = 1.0;
        } else {
            initial[0] = 0.5;
            initial[1] = 0.5;
        }
        return initial;
    }

    /**
     * Each state loops with {@code selfLoop} and advances with 1 - selfLoop; the last
     * state is absorbing.
     */
    public static double[][] leftToRightTransitions(int numStates, double selfLoop) {
        if (selfLoop < 0.0 || selfLoop > 1.0) {
            throw new IllegalArgumentException("Self-loop probability must be in [0, 1]: " + selfLoop);
        }
        double[][] transitions = new double[numStates][numStates];
        for (int j = 0; j < numStates - 1; j++) {
            transitions[j][j] = selfLoop;
            transitions[j][j + 1] = 1.0 - selfLoop;
        }
        transitions[numStates - 1][numStates - 1] = 1.0;
        return transitions;
    }
}
