package com.wordhmm.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordhmm.server.ai.RecognitionResult;
import com.wordhmm.server.ai.WordModelConfig;
import com.wordhmm.server.ai.emission.PhoneInventory;
import com.wordhmm.server.ai.hmm.EmptySequenceException;
import com.wordhmm.server.ai.hmm.ViterbiPath;
import com.wordhmm.server.ai.hmm.WordHmm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class WordRecognitionServiceTest {

    @TempDir
    Path dataDir;

    private WordModelConfig.ConfigRoot config;
    private PhoneInventory inventory;

    @BeforeEach
    public void setup() {
        config = WordModelConfig.loadDefault();
        inventory = new PhoneInventory(config.phoneInventory);
    }

    private WordRecognitionService newService() {
        WordRecognitionService service = new WordRecognitionService();
        service.initialize(config, dataDir.toString());
        return service;
    }

    /**
     * Each phone held for the given number of frames; the spoken phone scores 0, all others -10.
     */
    private double[][] utterance(String... phonesAndFrames) {
        int total = 0;
        for (int i = 1; i < phonesAndFrames.length; i += 2) {
            total += Integer.parseInt(phonesAndFrames[i]);
        }
        double[][] e = new double[total][inventory.size()];
        int t = 0;
        for (int i = 0; i < phonesAndFrames.length; i += 2) {
            int phone = inventory.indexOf(phonesAndFrames[i]);
            int frames = Integer.parseInt(phonesAndFrames[i + 1]);
            for (int f = 0; f < frames; f++, t++) {
                Arrays.fill(e[t], -10.0);
                e[t][phone] = 0.0;
            }
        }
        return e;
    }

    private double[][] rock() {
        return utterance("sil", "3", "r", "2", "aa", "4", "cl", "2", "k", "2", "sil", "3");
    }

    @Test
    public void testRecognizesConfiguredWords() {
        WordRecognitionService service = newService();

        assertTrue(service.isReady());
        assertEquals(List.of("fee", "pea", "rock", "burt", "see", "she"), service.getWords());

        assertEquals("rock", service.recognize(rock()).getPredictedWord());
        assertEquals("she",
                service.recognize(utterance("sil", "3", "sh", "4", "iy", "4", "sil", "3")).getPredictedWord());
        assertEquals("fee",
                service.recognize(utterance("sil", "3", "f", "4", "iy", "4", "sil", "3")).getPredictedWord());
    }

    @Test
    public void testDecodeFollowsPhoneOrder() {
        WordRecognitionService service = newService();

        ViterbiPath path = service.decode("rock", rock());

        assertArrayEquals(new int[] { 0, 0, 0, 1, 1, 2, 2, 2, 2, 3, 3, 4, 4, 5, 5, 5 }, path.getStates());
        assertTrue(Double.isFinite(path.getLogScore()));
    }

    @Test
    public void testAdaptationIsPersistedAndRestored() {
        WordRecognitionService service = newService();
        double[][] before = service.getTransitionProbabilities("rock");

        service.adapt("rock", rock());
        double[][] adapted = service.getTransitionProbabilities("rock");
        assertFalse(Arrays.deepEquals(before, adapted));
        // sil held for 3 frames: two self-loops and one advance
        assertEquals(2.0 / 3.0, adapted[0][0], 1e-12);
        assertEquals(1.0 / 3.0, adapted[0][1], 1e-12);

        WordRecognitionService reloaded = newService();
        assertTrue(Arrays.deepEquals(adapted, reloaded.getTransitionProbabilities("rock")));
        assertTrue(Arrays.deepEquals(service.getTransitionProbabilities("fee"),
                reloaded.getTransitionProbabilities("fee")));
    }

    @Test
    public void testResetRestoresConfiguredParameters() {
        WordRecognitionService service = newService();
        double[][] configured = service.getTransitionProbabilities("rock");

        service.adapt("rock", rock());
        service.resetWord("rock");

        assertTrue(Arrays.deepEquals(configured, service.getTransitionProbabilities("rock")));
        assertTrue(Arrays.deepEquals(configured, newService().getTransitionProbabilities("rock")));
        assertThrows(IllegalArgumentException.class, () -> service.resetWord("unknown"));
    }

    @Test
    public void testRecognizeUtteranceFromEmissionFile() throws Exception {
        File emissionsDir = dataDir.resolve("emissions").toFile();
        assertTrue(emissionsDir.mkdirs());
        new ObjectMapper().writeValue(new File(emissionsDir, "rock.json"),
                Collections.singletonMap("logLikelihoods", rock()));

        WordRecognitionService service = newService();
        RecognitionResult first = service.recognizeUtterance("rock.json");
        RecognitionResult cached = service.recognizeUtterance("rock.json");

        assertEquals("rock", first.getPredictedWord());
        assertArrayEquals(first.getLogLikelihoods(), cached.getLogLikelihoods());
        assertTrue(Files.exists(dataDir.resolve("wordhmm_cache.db")));
    }

    @Test
    public void testInvalidInputsSurfaceAsHmmErrors() {
        WordRecognitionService service = newService();

        assertThrows(EmptySequenceException.class, () -> service.recognize(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> service.decode("unknown", rock()));
    }

    @Test
    public void testUtteranceIdCannotLeaveEmissionsDirectory() throws Exception {
        assertTrue(dataDir.resolve("emissions").toFile().mkdirs());
        new ObjectMapper().writeValue(dataDir.resolve("secret.json").toFile(),
                Collections.singletonMap("logLikelihoods", rock()));
        WordRecognitionService service = newService();

        assertThrows(IllegalArgumentException.class, () -> service.recognizeUtterance("../secret.json"));
        assertThrows(IllegalArgumentException.class, () -> service.adaptUtterance("rock", "../secret.json"));
    }

    @Test
    public void testUpdateOfReplacedModelIsDiscarded() {
        WordRecognitionService service = newService();
        double[][] configured = service.getTransitionProbabilities("rock");
        WordHmm stale = service.currentModel("rock");

        service.resetWord("rock");
        service.adaptModel("rock", stale, rock());

        assertTrue(Arrays.deepEquals(configured, service.getTransitionProbabilities("rock")));
        assertTrue(Arrays.deepEquals(configured, newService().getTransitionProbabilities("rock")));
    }

    @Test
    public void testConcurrentAdaptAndResetKeepStoreInSync() throws Exception {
        WordRecognitionService service = newService();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<?>> jobs = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                jobs.add(pool.submit(() -> service.adapt("rock", rock())));
                jobs.add(pool.submit(() -> service.resetWord("rock")));
            }
            for (Future<?> job : jobs) {
                job.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(Arrays.deepEquals(service.getTransitionProbabilities("rock"),
                newService().getTransitionProbabilities("rock")));
    }
}
