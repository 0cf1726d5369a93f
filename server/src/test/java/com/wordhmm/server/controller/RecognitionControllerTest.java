package com.wordhmm.server.controller;

import com.wordhmm.server.ai.RecognitionResult;
import com.wordhmm.server.ai.WordModelConfig;
import com.wordhmm.server.ai.emission.PhoneInventory;
import com.wordhmm.server.service.CacheControlService;
import com.wordhmm.server.service.WordRecognitionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RecognitionControllerTest {

    @TempDir
    Path dataDir;

    private WordModelConfig.ConfigRoot config;
    private RecognitionController controller;

    @BeforeEach
    public void setup() {
        config = WordModelConfig.loadDefault();
        WordRecognitionService service = new WordRecognitionService();
        service.initialize(config, dataDir.toString());
        controller = new RecognitionController(service,
                new CacheControlService(dataDir.resolve("wordhmm_cache.db").toString()));
    }

    private static RecognitionController.EmissionRequest request(double[][] emissions, String utteranceId) {
        RecognitionController.EmissionRequest request = new RecognitionController.EmissionRequest();
        request.emissions = emissions;
        request.utteranceId = utteranceId;
        return request;
    }

    // sil r aa cl k sil, each phone scoring 0 against -10 for the rest
    private double[][] rock() {
        PhoneInventory inventory = new PhoneInventory(config.phoneInventory);
        String[] phones = { "sil", "sil", "sil", "r", "r", "aa", "aa", "aa", "aa", "cl", "cl", "k", "k",
                "sil", "sil", "sil" };
        double[][] e = new double[phones.length][inventory.size()];
        for (int t = 0; t < phones.length; t++) {
            Arrays.fill(e[t], -10.0);
            e[t][inventory.indexOf(phones[t])] = 0.0;
        }
        return e;
    }

    @Test
    public void testNotReadyIsServiceUnavailable() {
        RecognitionController loading = new RecognitionController(new WordRecognitionService(),
                new CacheControlService(dataDir.resolve("wordhmm_cache.db").toString()));

        assertEquals(503, loading.words().getStatusCode().value());
        assertEquals(503, loading.recognize(request(rock(), null)).getStatusCode().value());
        assertEquals(503, loading.decode("rock", request(rock(), null)).getStatusCode().value());
        assertEquals(503, loading.adapt("rock", request(rock(), null)).getStatusCode().value());
        assertEquals(503, loading.reset("rock").getStatusCode().value());
    }

    @Test
    public void testUnknownWordIsNotFound() {
        assertEquals(404, controller.decode("unknown", request(rock(), null)).getStatusCode().value());
        assertEquals(404, controller.adapt("unknown", request(rock(), null)).getStatusCode().value());
        assertEquals(404, controller.reset("unknown").getStatusCode().value());
    }

    @Test
    public void testInvalidEmissionsAreBadRequest() {
        double[][] gap = { rock()[0], null };

        assertEquals(400, controller.decode("rock", request(new double[0][], null)).getStatusCode().value());
        assertEquals(400, controller.decode("rock", request(gap, null)).getStatusCode().value());
        assertEquals(400, controller.decode("rock", request(new double[][] { { 0.0 } }, null))
                .getStatusCode().value());
        assertEquals(400, controller.recognize(request(new double[0][], null)).getStatusCode().value());
        assertEquals(400, controller.recognize(request(gap, null)).getStatusCode().value());
        assertEquals(400, controller.adapt("rock", request(new double[0][], null)).getStatusCode().value());
    }

    @Test
    public void testRequestWithoutInputIsBadRequest() {
        assertEquals(400, controller.recognize(request(null, null)).getStatusCode().value());
        assertEquals(400, controller.decode("rock", request(null, null)).getStatusCode().value());
        assertEquals(400, controller.adapt("rock", request(null, null)).getStatusCode().value());
    }

    @Test
    public void testUtteranceOutsideEmissionsDirectoryIsBadRequest() {
        assertEquals(400, controller.recognize(request(null, "../secret.json")).getStatusCode().value());
        assertEquals(400, controller.adapt("rock", request(null, "../secret.json")).getStatusCode().value());
    }

    @Test
    public void testValidRequestsSucceed() {
        ResponseEntity<?> recognized = controller.recognize(request(rock(), null));
        assertEquals(200, recognized.getStatusCode().value());
        assertEquals("rock", ((RecognitionResult) recognized.getBody()).getPredictedWord());

        ResponseEntity<?> decoded = controller.decode("rock", request(rock(), null));
        assertEquals(200, decoded.getStatusCode().value());
        Map<?, ?> body = (Map<?, ?>) decoded.getBody();
        assertEquals("rock", body.get("word"));
        assertEquals(rock().length, ((int[]) body.get("states")).length);

        ResponseEntity<?> adapted = controller.adapt("rock", request(rock(), null));
        assertEquals(200, adapted.getStatusCode().value());
        assertTrue(((Map<?, ?>) adapted.getBody()).containsKey("transitions"));

        assertEquals(200, controller.reset("rock").getStatusCode().value());
        assertEquals(200, controller.words().getStatusCode().value());
        assertEquals(200, controller.clearEmissionCache("json", "v1").getStatusCode().value());
    }
}
