package com.wordhmm.server.ai;

import com.wordhmm.server.ai.emission.PhoneInventory;
import com.wordhmm.server.ai.hmm.WordHmm;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WordRecognizerTest {

    private static final PhoneInventory INVENTORY = new PhoneInventory(List.of("sil", "a", "b"));

    private static WordRecognizer recognizer() {
        WordModelFactory factory = new WordModelFactory(INVENTORY, WordHmm.DEFAULT_EPSILON);
        Map<String, WordHmm> models = new LinkedHashMap<>();
        models.put("ab", factory.build(node("ab", "sil", "a", "b", "sil")));
        models.put("ba", factory.build(node("ba", "sil", "b", "a", "sil")));
        return new WordRecognizer(models);
    }

    private static WordModelConfig.WordNode node(String word, String... phones) {
        WordModelConfig.WordNode n = new WordModelConfig.WordNode();
        n.word = word;
        n.phones = Arrays.asList(phones);
        return n;
    }

    private static double[][] utterance(String... phones) {
        double[][] e = new double[phones.length][INVENTORY.size()];
        for (int t = 0; t < phones.length; t++) {
            Arrays.fill(e[t], -8.0);
            e[t][INVENTORY.indexOf(phones[t])] = 0.0;
        }
        return e;
    }

    private static double[][] saidAb() {
        return utterance("sil", "sil", "a", "a", "a", "b", "b", "b", "sil", "sil");
    }

    private static double[][] saidBa() {
        return utterance("sil", "sil", "b", "b", "b", "a", "a", "a", "sil", "sil");
    }

    @Test
    void testRecognizesMatchingWord() {
        WordRecognizer recognizer = recognizer();

        RecognitionResult ab = recognizer.recognize(saidAb());
        assertEquals("ab", ab.getPredictedWord());
        assertEquals(List.of("ab", "ba"), ab.getWords());
        assertTrue(ab.getLogLikelihood("ab") > ab.getLogLikelihood("ba"));

        assertEquals("ba", recognizer.recognize(saidBa()).getPredictedWord());
    }

    @Test
    void testScoreMatrixHasWordRowsAndUtteranceColumns() {
        WordRecognizer recognizer = recognizer();
        double[][] matrix = recognizer.scoreMatrix(List.of(saidAb(), saidBa()));

        assertEquals(2, matrix.length);
        assertEquals(2, matrix[0].length);
        assertTrue(matrix[0][0] > matrix[1][0]);
        assertTrue(matrix[1][1] > matrix[0][1]);
    }

    @Test
    void testEvaluateAccuracy() {
        WordRecognizer recognizer = recognizer();
        List<LabeledUtterance> data = List.of(
                new LabeledUtterance("ab-1", "ab", saidAb()),
                new LabeledUtterance("ba-1", "ba", saidBa()),
                new LabeledUtterance("ba-2", "ba", saidAb()));

        assertEquals(2.0 / 3.0, recognizer.evaluateAccuracy(data), 1e-12);
    }

    @Test
    void testUnknownWord() {
        WordRecognizer recognizer = recognizer();
        assertFalse(recognizer.hasWord("cd"));
        assertThrows(IllegalArgumentException.class, () -> recognizer.getModel("cd"));
    }

    @Test
    void testEmptyModelSetIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WordRecognizer(new LinkedHashMap<>()));
    }
}
