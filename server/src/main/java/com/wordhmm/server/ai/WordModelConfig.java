package com.wordhmm.server.ai;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.InputStream;
import java.util.List;

/**
 * JSON model of {@code word_models.json}.
 */
public class WordModelConfig {

    public static final String RESOURCE = "/word_models.json";

    public static class EmissionConfig {
        public String directory = "emissions";
        public String providerVersion = "v1";
        public Boolean cacheEnabled = true;
    }

    public static class WordNode {
        public String word;
        public List<String> phones;

        // Explicit parameters; if absent a left-to-right topology is generated
        public double[] initial;
        public double[][] transitions;
        public Double selfLoop;
    }

    public static class ConfigRoot {
        public String wordhmm_data_directory;
        public Double epsilon;
        public List<String> phoneInventory;
        public EmissionConfig emission;
        public List<WordNode> words;
    }

    public static ConfigRoot load(InputStream jsonStream) {
        if (jsonStream == null) {
            throw new IllegalArgumentException("Word model configuration stream is null");
        }
        try (InputStream is = jsonStream) {
            ObjectMapper mapper = new ObjectMapper();
            return mapper.readValue(is, ConfigRoot.class);
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse word model configuration", e);
        }
    }

    public static ConfigRoot loadDefault() {
        return load(WordModelConfig.class.getResourceAsStream(RESOURCE));
    }
}
