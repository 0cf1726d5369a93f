package com.wordhmm.server.ai.emission;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Reads classifier output written by the offline acoustic front end.
 * Each utterance is a JSON file holding either {@code logPosteriors}, which are
 * prior-corrected on load, or ready-made {@code logLikelihoods}.
 */
public class JsonEmissionProvider implements EmissionProvider {

    private static final Logger logger = LoggerFactory.getLogger(JsonEmissionProvider.class);
    private static final String PROVIDER_TYPE = "json";

    private final File baseDir;
    private final int inventorySize;
    private final String version;
    private final ObjectMapper mapper = new ObjectMapper();

    public JsonEmissionProvider(File baseDir, int inventorySize, String version) {
        this.baseDir = baseDir;
        this.inventorySize = inventorySize;
        this.version = version;
    }

    @Override
    public String getProviderType() {
        return PROVIDER_TYPE;
    }

    @Override
    public String getProviderVersion() {
        return version;
    }

    @Override
    public double[][] computeLogLikelihoods(String utteranceId) {
        File file = resolve(utteranceId);
        try {
            JsonNode root = mapper.readTree(file);
            double[][] likelihoods;
            if (root.has("logLikelihoods")) {
                likelihoods = mapper.convertValue(root.get("logLikelihoods"), double[][].class);
            } else if (root.has("logPosteriors")) {
                likelihoods = PriorCorrection.uniform(
                        mapper.convertValue(root.get("logPosteriors"), double[][].class));
            } else {
                throw new IllegalArgumentException(
                        "Utterance " + utteranceId + " has neither logLikelihoods nor logPosteriors");
            }
            validate(utteranceId, likelihoods);
            logger.debug("Loaded {} frames for utterance {}", likelihoods.length, utteranceId);
            return likelihoods;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read emissions for utterance " + file.getPath(), e);
        }
    }

    /**
     * Maps an utterance id to its file, refusing ids that name anything outside the base directory.
     */
    File resolve(String utteranceId) {
        if (utteranceId == null || utteranceId.isEmpty()) {
            throw new IllegalArgumentException("Utterance id is empty");
        }
        try {
            File root = baseDir.getCanonicalFile();
            File file = new File(root, utteranceId).getCanonicalFile();
            if (!file.getPath().startsWith(root.getPath() + File.separator)) {
                throw new IllegalArgumentException("Utterance " + utteranceId + " is outside " + root.getPath());
            }
            return file;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot resolve utterance " + utteranceId, e);
        }
    }

    private void validate(String utteranceId, double[][] likelihoods) {
        if (likelihoods == null || likelihoods.length == 0) {
            throw new IllegalArgumentException("Utterance " + utteranceId + " has no frames");
        }
        for (int t = 0; t < likelihoods.length; t++) {
            if (likelihoods[t] == null || likelihoods[t].length != inventorySize) {
                throw new IllegalArgumentException("Utterance " + utteranceId + " frame " + t + " has "
                        + (likelihoods[t] == null ? 0 : likelihoods[t].length) + " classes, expected "
                        + inventorySize);
            }
        }
    }
}
