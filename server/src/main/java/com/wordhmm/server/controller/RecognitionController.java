package com.wordhmm.server.controller;

import com.wordhmm.server.ai.RecognitionResult;
import com.wordhmm.server.ai.hmm.HmmException;
import com.wordhmm.server.ai.hmm.ViterbiPath;
import com.wordhmm.server.service.CacheControlService;
import com.wordhmm.server.service.WordRecognitionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class RecognitionController {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionController.class);
    private final WordRecognitionService recognitionService;
    private final CacheControlService cacheControlService;

    public RecognitionController(WordRecognitionService recognitionService,
            CacheControlService cacheControlService) {
        this.recognitionService = recognitionService;
        this.cacheControlService = cacheControlService;
    }

    public static class EmissionRequest {
        // T x L emission log-likelihoods over the full phone inventory
        public double[][] emissions;
        // Alternatively, an utterance file under the configured emissions directory
        public String utteranceId;
    }

    @GetMapping("/words")
    public ResponseEntity<?> words() {
        if (!recognitionService.isReady()) {
            return notReady();
        }
        return ResponseEntity.ok(recognitionService.getWords());
    }

    @PostMapping("/recognize-word")
    public ResponseEntity<?> recognize(@RequestBody EmissionRequest request) {
        if (!recognitionService.isReady()) {
            return notReady();
        }

        logger.info("Received recognition request.");
        try {
            RecognitionResult result;
            if (request.emissions != null) {
                result = recognitionService.recognize(request.emissions);
            } else if (request.utteranceId != null) {
                result = recognitionService.recognizeUtterance(request.utteranceId);
            } else {
                return ResponseEntity.badRequest().body("Request needs either emissions or utteranceId.");
            }
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/words/{word}/decode")
    public ResponseEntity<?> decode(@PathVariable("word") String word, @RequestBody EmissionRequest request) {
        if (!recognitionService.isReady()) {
            return notReady();
        }
        if (!recognitionService.hasWord(word)) {
            return ResponseEntity.status(404).body("Unknown word: " + word);
        }
        if (request.emissions == null) {
            return ResponseEntity.badRequest().body("Request needs emissions.");
        }
        try {
            return ResponseEntity.ok(pathBody(word, recognitionService.decode(word, request.emissions)));
        } catch (HmmException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/words/{word}/adapt")
    public ResponseEntity<?> adapt(@PathVariable("word") String word, @RequestBody EmissionRequest request) {
        if (!recognitionService.isReady()) {
            return notReady();
        }
        if (!recognitionService.hasWord(word)) {
            return ResponseEntity.status(404).body("Unknown word: " + word);
        }
        if (request.emissions == null && request.utteranceId == null) {
            return ResponseEntity.badRequest().body("Request needs either emissions or utteranceId.");
        }
        try {
            ViterbiPath alignment = request.emissions != null
                    ? recognitionService.adapt(word, request.emissions)
                    : recognitionService.adaptUtterance(word, request.utteranceId);
            Map<String, Object> body = pathBody(word, alignment);
            body.put("transitions", recognitionService.getTransitionProbabilities(word));
            return ResponseEntity.ok(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/words/{word}/reset")
    public ResponseEntity<?> reset(@PathVariable("word") String word) {
        if (!recognitionService.isReady()) {
            return notReady();
        }
        if (!recognitionService.hasWord(word)) {
            return ResponseEntity.status(404).body("Unknown word: " + word);
        }
        recognitionService.resetWord(word);
        return ResponseEntity.ok(recognitionService.getTransitionProbabilities(word));
    }

    @PostMapping("/emissions/cache/clear")
    public ResponseEntity<?> clearEmissionCache(@RequestParam("type") String providerType,
            @RequestParam("version") String providerVersion) {
        cacheControlService.clearProvider(providerType, providerVersion);
        return ResponseEntity.ok().build();
    }

    private static Map<String, Object> pathBody(String word, ViterbiPath path) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("word", word);
        body.put("states", path.getStates());
        body.put("logScore", path.getLogScore());
        return body;
    }

    private static ResponseEntity<String> notReady() {
        return ResponseEntity.status(503).body("Word models are still loading, please try again later.");
    }
}
