package com.wordhmm.server.ai.hmm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Hidden Markov model of a single word. Each state is tied to one phone of the
 * shared inventory; emissions come from an external classifier as per-frame
 * log-likelihoods over the whole inventory.
 *
 * All parameters are kept in the log domain. Probabilities are floored by
 * {@code epsilon} before every logarithm so that stored values stay finite.
 *
 * Instances are not thread-safe: {@link #viterbiTransitionUpdate(double[][])}
 * replaces the transition matrix that {@link #forward(double[][])} and
 * {@link #viterbi(double[][])} read.
 */
public class WordHmm {
    private static final Logger logger = LoggerFactory.getLogger(WordHmm.class);

    public static final double DEFAULT_EPSILON = 1e-200;

    private final int[] stateLabels;
    private final double[] initialLogProb;
    // [fromState][toState]
    private double[][] transitionLogProb;
    private final double epsilon;
    private final int numStates;

    public WordHmm(int[] stateLabels, double[] initialDist, double[][] transitionMatrix) {
        this(stateLabels, initialDist, transitionMatrix, DEFAULT_EPSILON);
    }

    public WordHmm(int[] stateLabels, double[] initialDist, double[][] transitionMatrix, double epsilon) {
        checkShape(stateLabels, initialDist, transitionMatrix);
        this.stateLabels = stateLabels.clone();
        this.numStates = stateLabels.length;
        this.epsilon = epsilon;
        this.initialLogProb = HmmMath.flooredLog(initialDist, epsilon);
        this.transitionLogProb = new double[numStates][];
        for (int j = 0; j < numStates; j++) {
            transitionLogProb[j] = HmmMath.flooredLog(transitionMatrix[j], epsilon);
        }
    }

    private WordHmm(int[] stateLabels, double[] initialLogProb, double[][] transitionLogProb, double epsilon,
            boolean alreadyLogged) {
        this.stateLabels = stateLabels.clone();
        this.numStates = stateLabels.length;
        this.epsilon = epsilon;
        this.initialLogProb = initialLogProb.clone();
        this.transitionLogProb = HmmMath.copyOf(transitionLogProb);
    }

    /**
     * Rebuilds a model from parameters that are already in the log domain,
     * e.g. after loading them from storage. No flooring is applied.
     */
    public static WordHmm fromLogParameters(int[] stateLabels, double[] initialLogProb,
            double[][] transitionLogProb, double epsilon) {
        checkShape(stateLabels, initialLogProb, transitionLogProb);
        return new WordHmm(stateLabels, initialLogProb, transitionLogProb, epsilon, true);
    }

    private static void checkShape(int[] stateLabels, double[] initial, double[][] transitions) {
        if (stateLabels == null || stateLabels.length == 0) {
            throw new InvalidShapeException("A word model needs at least one state");
        }
        int n = stateLabels.length;
        if (initial == null || initial.length != n) {
            throw new InvalidShapeException("Initial distribution length "
                    + (initial == null ? "null" : initial.length) + " does not match " + n + " states");
        }
        if (transitions == null || transitions.length != n) {
            throw new InvalidShapeException("Transition matrix must be " + n + "x" + n);
        }
        for (int j = 0; j < n; j++) {
            if (transitions[j] == null || transitions[j].length != n) {
                throw new InvalidShapeException("Transition matrix row " + j + " must have " + n + " entries");
            }
        }
    }

    /**
     * Selects, for every frame, the inventory columns this model's states are tied to.
     *
     * @param emissions T x L log-likelihoods over the full phone inventory
     * @return T x N log-likelihoods, entry [t][j] = emissions[t][stateLabels[j]]
     */
    public double[][] restrictEmissions(double[][] emissions) {
        double[][] stateEmissions = new double[emissions.length][numStates];
        for (int t = 0; t < emissions.length; t++) {
            double[] frame = emissions[t];
            if (frame == null) {
                throw new ShapeMismatchException("Frame " + t + " is missing");
            }
            for (int j = 0; j < numStates; j++) {
                int label = stateLabels[j];
                if (label < 0 || label >= frame.length) {
                    throw new ShapeMismatchException("State " + j + " label " + label
                            + " is out of range for frame " + t + " with " + frame.length + " classes");
                }
                stateEmissions[t][j] = frame[label];
            }
        }
        return stateEmissions;
    }

    private double[][] checkedStateEmissions(double[][] emissions) {
        if (emissions == null || emissions.length == 0) {
            throw new EmptySequenceException();
        }
        return restrictEmissions(emissions);
    }

    /**
     * Log-domain forward algorithm.
     *
     * @return alpha[T-1][N-1], the log probability of the observations with the
     *         last frame in the model's final state. Paths ending in other states
     *         are not summed in.
     */
    public double forward(double[][] emissions) {
        double[][] b = checkedStateEmissions(emissions);
        int numFrames = b.length;

        double[] alpha = new double[numStates];
        for (int i = 0; i < numStates; i++) {
            alpha[i] = initialLogProb[i] + b[0][i];
        }

        double[] terms = new double[numStates];
        for (int t = 1; t < numFrames; t++) {
            double[] next = new double[numStates];
            for (int i = 0; i < numStates; i++) {
                for (int j = 0; j < numStates; j++) {
                    terms[j] = alpha[j] + transitionLogProb[j][i];
                }
                next[i] = HmmMath.logSumExp(terms) + b[t][i];
            }
            alpha = next;
        }

        double score = alpha[numStates - 1];
        logger.trace("Forward over {} frames: final-state log-likelihood = {}", numFrames, score);
        return score;
    }

    /**
     * Most likely state sequence, one state index per frame.
     */
    public int[] viterbi(double[][] emissions) {
        return decode(emissions).getStates();
    }

    /**
     * Log-domain Viterbi algorithm with backpointer reconstruction.
     * Ties are resolved in favour of the smallest state index.
     */
    public ViterbiPath decode(double[][] emissions) {
        double[][] b = checkedStateEmissions(emissions);
        int numFrames = b.length;

        double[][] delta = new double[numFrames][numStates];
        int[][] psi = new int[numFrames][numStates];

        for (int i = 0; i < numStates; i++) {
            delta[0][i] = initialLogProb[i] + b[0][i];
        }

        double[] candidates = new double[numStates];
        for (int t = 1; t < numFrames; t++) {
            for (int i = 0; i < numStates; i++) {
                for (int j = 0; j < numStates; j++) {
                    candidates[j] = delta[t - 1][j] + transitionLogProb[j][i];
                }
                int best = HmmMath.argmax(candidates);
                psi[t][i] = best;
                delta[t][i] = candidates[best] + b[t][i];
            }
        }

        int[] path = new int[numFrames];
        path[numFrames - 1] = HmmMath.argmax(delta[numFrames - 1]);
        for (int t = numFrames - 2; t >= 0; t--) {
            path[t] = psi[t + 1][path[t + 1]];
        }

        double score = delta[numFrames - 1][path[numFrames - 1]];
        if (logger.isTraceEnabled()) {
            logger.trace("Viterbi path {} with log score {}", Arrays.toString(path), score);
        }
        return new ViterbiPath(path, score);
    }

    /**
     * Viterbi training step: aligns the utterance with its best path and replaces
     * the transition matrix by the row-normalized transition counts of that path.
     * A state the path never leaves gets the all-epsilon row.
     *
     * @return the alignment the counts were taken from
     */
    public ViterbiPath viterbiTransitionUpdate(double[][] emissions) {
        ViterbiPath alignment = decode(emissions);
        int[] path = alignment.getStates();

        long[][] transitionCounts = new long[numStates][numStates];
        long[] outCounts = new long[numStates];
        for (int t = 0; t < path.length - 1; t++) {
            transitionCounts[path[t]][path[t + 1]]++;
            outCounts[path[t]]++;
        }

        double[][] updated = new double[numStates][numStates];
        for (int j = 0; j < numStates; j++) {
            for (int i = 0; i < numStates; i++) {
                double prob = outCounts[j] == 0 ? 0.0 : (double) transitionCounts[j][i] / outCounts[j];
                updated[j][i] = Math.log(prob + epsilon);
            }
            if (outCounts[j] == 0) {
                logger.debug("State {} has no outgoing transitions on the best path, row floored to epsilon", j);
            }
        }
        this.transitionLogProb = updated;

        logger.debug("Re-estimated transitions from a {}-frame alignment", path.length);
        return alignment;
    }

    /**
     * Independent copy of this model, safe to evaluate while the original is re-estimated.
     */
    public WordHmm copy() {
        return new WordHmm(stateLabels, initialLogProb, transitionLogProb, epsilon, true);
    }

    public int getNumStates() {
        return numStates;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public int[] getStateLabels() {
        return stateLabels.clone();
    }

    public double[] getInitialLogProb() {
        return initialLogProb.clone();
    }

    public double[][] getTransitionLogProb() {
        return HmmMath.copyOf(transitionLogProb);
    }

    /**
     * Transition probabilities recovered from the log domain, exp(logA) - epsilon.
     */
    public double[][] getTransitionProbabilities() {
        double[][] probs = new double[numStates][];
        for (int j = 0; j < numStates; j++) {
            probs[j] = HmmMath.unfloorExp(transitionLogProb[j], epsilon);
        }
        return probs;
    }
}
