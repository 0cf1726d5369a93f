package com.wordhmm.server.service;

import com.wordhmm.db.EmissionResultDao;
import com.wordhmm.db.SqliteInitializer;
import com.wordhmm.db.UtteranceDao;
import com.wordhmm.db.WordModelDao;
import com.wordhmm.server.ai.RecognitionResult;
import com.wordhmm.server.ai.WordModelConfig;
import com.wordhmm.server.ai.WordModelFactory;
import com.wordhmm.server.ai.WordRecognizer;
import com.wordhmm.server.ai.emission.CachedEmissionProvider;
import com.wordhmm.server.ai.emission.EmissionProvider;
import com.wordhmm.server.ai.emission.JsonEmissionProvider;
import com.wordhmm.server.ai.hmm.ViterbiPath;
import com.wordhmm.server.ai.hmm.WordHmm;
import com.wordhmm.server.util.DataPathResolver;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the configured word models. Evaluation and re-estimation of the same model
 * are serialized on the model instance; different words are independent.
 */
@Service
public class WordRecognitionService {

    private static final Logger logger = LoggerFactory.getLogger(WordRecognitionService.class);

    private WordModelConfig.ConfigRoot config;
    private WordModelFactory factory;
    private WordModelDao modelDao;
    private EmissionProvider emissionProvider;
    private volatile WordRecognizer recognizer;
    private volatile boolean isReady = false;
    private final Map<String, Object> wordLocks = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        String dataDir = DataPathResolver.resolveDataDirectory();
        logger.info("Initializing Word Recognition Service with data directory {}", dataDir);
        initialize(WordModelConfig.loadDefault(), dataDir);
    }

    /**
     * Builds the models from {@code config} and opens the model store under {@code dataDir}.
     */
    public synchronized void initialize(WordModelConfig.ConfigRoot config, String dataDir) {
        this.config = config;
        this.factory = WordModelFactory.fromConfig(config);

        String dbPath = DataPathResolver.resolveDbPath(dataDir);
        try {
            SqliteInitializer.initialize(dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database at " + dbPath, e);
        }
        this.modelDao = new WordModelDao(dbPath);

        Map<String, WordHmm> models = factory.buildAll(config);
        restorePersistedModels(models);
        this.recognizer = new WordRecognizer(models);

        this.emissionProvider = createEmissionProvider(config.emission, dataDir, dbPath);

        isReady = true;
        logger.info("Word Recognition Service ready with words {}", recognizer.getWords());
    }

    private void restorePersistedModels(Map<String, WordHmm> models) {
        Map<String, WordHmm> stored;
        try {
            stored = modelDao.findAll();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load persisted word models", e);
        }
        for (Map.Entry<String, WordHmm> entry : stored.entrySet()) {
            WordHmm configured = models.get(entry.getKey());
            if (configured == null) {
                logger.debug("Ignoring persisted model for unconfigured word '{}'", entry.getKey());
                continue;
            }
            if (!Arrays.equals(configured.getStateLabels(), entry.getValue().getStateLabels())) {
                logger.warn("Persisted model for '{}' has different phones than the configuration, ignoring it",
                        entry.getKey());
                continue;
            }
            models.put(entry.getKey(), entry.getValue());
            logger.info("Restored re-estimated transitions for '{}'", entry.getKey());
        }
    }

    private EmissionProvider createEmissionProvider(WordModelConfig.EmissionConfig emissionConfig, String dataDir,
            String dbPath) {
        WordModelConfig.EmissionConfig ec = emissionConfig != null ? emissionConfig
                : new WordModelConfig.EmissionConfig();
        File emissionsDir = new File(dataDir, ec.directory);
        EmissionProvider provider = new JsonEmissionProvider(emissionsDir, factory.getInventory().size(),
                ec.providerVersion);
        if (Boolean.FALSE.equals(ec.cacheEnabled)) {
            return provider;
        }
        return new CachedEmissionProvider(provider, new UtteranceDao(dbPath), new EmissionResultDao(dbPath));
    }

    public boolean isReady() {
        return isReady;
    }

    public List<String> getWords() {
        return recognizer.getWords();
    }

    public boolean hasWord(String word) {
        return recognizer != null && recognizer.hasWord(word);
    }

    public RecognitionResult recognize(double[][] emissions) {
        return recognizer.recognize(emissions);
    }

    public RecognitionResult recognizeUtterance(String utteranceId) {
        double[][] emissions = emissionProvider.computeLogLikelihoods(utteranceId);
        logger.info("Recognizing utterance {} ({} frames)", utteranceId, emissions.length);
        return recognize(emissions);
    }

    public ViterbiPath decode(String word, double[][] emissions) {
        WordHmm hmm = recognizer.getModel(word);
        synchronized (hmm) {
            return hmm.decode(emissions);
        }
    }

    /**
     * Runs one Viterbi re-estimation of {@code word}'s transitions on the utterance
     * and stores the result.
     */
    public ViterbiPath adapt(String word, double[][] emissions) {
        synchronized (lockFor(word)) {
            return adaptModel(word, recognizer.getModel(word), emissions);
        }
    }

    /**
     * Re-estimates {@code hmm} and persists it only while it is still the live model for
     * {@code word}. Callers hold the word lock.
     */
    ViterbiPath adaptModel(String word, WordHmm hmm, double[][] emissions) {
        ViterbiPath alignment;
        WordHmm snapshot;
        synchronized (hmm) {
            alignment = hmm.viterbiTransitionUpdate(emissions);
            snapshot = hmm.copy();
        }
        if (recognizer.getModel(word) != hmm) {
            logger.warn("Model for '{}' was replaced during re-estimation, discarding the update", word);
            return alignment;
        }
        try {
            modelDao.save(word, snapshot);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to persist re-estimated model for " + word, e);
        }
        logger.info("Adapted '{}' on a {}-frame utterance, alignment score {}", word, alignment.length(),
                alignment.getLogScore());
        return alignment;
    }

    public ViterbiPath adaptUtterance(String word, String utteranceId) {
        return adapt(word, emissionProvider.computeLogLikelihoods(utteranceId));
    }

    /**
     * Drops any re-estimation of {@code word} and rebuilds it from the configuration.
     */
    public synchronized void resetWord(String word) {
        Optional<WordModelConfig.WordNode> node = config.words.stream()
                .filter(n -> word.equals(n.word))
                .findFirst();
        if (!node.isPresent()) {
            throw new IllegalArgumentException("Unknown word: " + word);
        }
        synchronized (lockFor(word)) {
            try {
                modelDao.delete(word);
            } catch (SQLException e) {
                throw new RuntimeException("Failed to delete persisted model for " + word, e);
            }

            Map<String, WordHmm> models = new LinkedHashMap<>();
            for (String w : recognizer.getWords()) {
                models.put(w, w.equals(word) ? factory.build(node.get()) : recognizer.getModel(w));
            }
            this.recognizer = new WordRecognizer(models);
        }
        logger.info("Reset '{}' to its configured parameters", word);
    }

    WordHmm currentModel(String word) {
        return recognizer.getModel(word);
    }

    // Held by adapt and reset so that a reset never interleaves with storing an update
    private Object lockFor(String word) {
        return wordLocks.computeIfAbsent(word, w -> new Object());
    }

    /**
     * Snapshot of the current transition probabilities of {@code word}.
     */
    public double[][] getTransitionProbabilities(String word) {
        WordHmm hmm = recognizer.getModel(word);
        synchronized (hmm) {
            return hmm.getTransitionProbabilities();
        }
    }
}
