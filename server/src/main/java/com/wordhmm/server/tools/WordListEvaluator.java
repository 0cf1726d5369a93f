package com.wordhmm.server.tools;

import com.wordhmm.server.ai.LabeledUtterance;
import com.wordhmm.server.ai.WordModelConfig;
import com.wordhmm.server.ai.WordModelFactory;
import com.wordhmm.server.ai.WordRecognizer;
import com.wordhmm.server.ai.emission.JsonEmissionProvider;
import com.wordhmm.server.ai.hmm.HmmMath;
import com.wordhmm.server.ai.hmm.ViterbiPath;
import com.wordhmm.server.ai.hmm.WordHmm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Offline tool that scores every configured word model against one utterance per word.
 * Usage: WordListEvaluator <emissionsDir> [--adapt <word>]
 *
 * The utterance for word w is read from {@code <emissionsDir>/<w>.json}.
 */
public class WordListEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(WordListEvaluator.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: WordListEvaluator <emissionsDir> [--adapt <word>]");
            System.exit(1);
        }

        File emissionsDir = new File(args[0]);
        if (!emissionsDir.isDirectory()) {
            System.err.println("Invalid emissions directory: " + args[0]);
            System.exit(1);
        }

        String adaptWord = null;
        if (args.length >= 3 && "--adapt".equals(args[1])) {
            adaptWord = args[2];
        }

        WordModelConfig.ConfigRoot config = WordModelConfig.loadDefault();
        WordModelFactory factory = WordModelFactory.fromConfig(config);
        Map<String, WordHmm> models = factory.buildAll(config);
        WordRecognizer recognizer = new WordRecognizer(models);

        JsonEmissionProvider provider = new JsonEmissionProvider(emissionsDir, factory.getInventory().size(),
                "offline");

        List<LabeledUtterance> utterances = new ArrayList<>();
        for (String word : recognizer.getWords()) {
            String utteranceId = word + ".json";
            if (!new File(emissionsDir, utteranceId).isFile()) {
                logger.warn("No utterance file for '{}', skipping", word);
                continue;
            }
            utterances.add(new LabeledUtterance(utteranceId, word, provider.computeLogLikelihoods(utteranceId)));
        }
        logger.info("Loaded {} utterances from {}", utterances.size(), emissionsDir.getAbsolutePath());

        if (utterances.isEmpty()) {
            logger.warn("No utterances found, exiting.");
            return;
        }

        printLikelihoods(System.out, recognizer, utterances);

        if (adaptWord != null) {
            if (!recognizer.hasWord(adaptWord)) {
                System.err.println("Unknown word: " + adaptWord);
                System.exit(1);
            }
            LabeledUtterance own = null;
            for (LabeledUtterance utt : utterances) {
                if (utt.label.equals(adaptWord)) {
                    own = utt;
                }
            }
            if (own == null) {
                System.err.println("No utterance for word: " + adaptWord);
                System.exit(1);
            }
            printAdaptation(System.out, recognizer.getModel(adaptWord), own);
        }
    }

    static void printLikelihoods(PrintStream out, WordRecognizer recognizer, List<LabeledUtterance> utterances) {
        List<double[][]> emissions = new ArrayList<>();
        for (LabeledUtterance utt : utterances) {
            emissions.add(utt.emissions);
        }
        double[][] matrix = recognizer.scoreMatrix(emissions);
        List<String> words = recognizer.getWords();

        out.println();
        out.println("Likelihood Computation");
        out.println();
        for (int u = 0; u < utterances.size(); u++) {
            double[] row = new double[words.size()];
            for (int w = 0; w < words.size(); w++) {
                row[w] = matrix[w][u];
            }
            out.println(utterances.get(u).label + " likelihoods: " + Arrays.toString(row));
        }

        int correct = 0;
        for (int u = 0; u < utterances.size(); u++) {
            int best = 0;
            for (int w = 1; w < words.size(); w++) {
                if (matrix[w][u] > matrix[best][u]) {
                    best = w;
                }
            }
            String label = utterances.get(u).label;
            out.println(label + " -> " + words.get(best));
            if (label.equals(words.get(best))) {
                correct++;
            }
        }
        out.println("Correct: " + correct + "/" + utterances.size());
    }

    static void printAdaptation(PrintStream out, WordHmm hmm, LabeledUtterance utterance) {
        double[][] before = hmm.getTransitionLogProb();
        double logLBefore = hmm.forward(utterance.emissions);

        ViterbiPath alignment = hmm.viterbiTransitionUpdate(utterance.emissions);

        double[][] after = hmm.getTransitionLogProb();
        double logLAfter = hmm.forward(utterance.emissions);

        out.println();
        out.println("Viterbi Update for '" + utterance.label + "'");
        out.println();
        out.println("Optimal state sequence: " + Arrays.toString(alignment.getStates()));
        out.println("Log likelihood before update: " + logLBefore);
        out.println("Log likelihood after update: " + logLAfter);
        out.println("Old transition matrix (log):");
        printMatrix(out, before);
        out.println("New transition matrix (log):");
        printMatrix(out, after);
        out.println("Max absolute change: " + HmmMath.maxAbsDelta(before, after));
    }

    private static void printMatrix(PrintStream out, double[][] matrix) {
        for (double[] row : matrix) {
            out.println("  " + Arrays.toString(row));
        }
    }
}
