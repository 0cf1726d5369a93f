package com.wordhmm.server.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;

public class DataPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static final String DATA_DIR_PROPERTY = "wordhmm.data.dir";

    public static String resolveDataDirectory() {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        try {
            ObjectMapper mapper = new ObjectMapper();
            try (InputStream is = DataPathResolver.class.getResourceAsStream("/word_models.json")) {
                if (is != null) {
                    JsonNode root = mapper.readTree(is);
                    if (root.has("wordhmm_data_directory") && !root.get("wordhmm_data_directory").isNull()) {
                        String configDir = root.get("wordhmm_data_directory").asText();
                        if (configDir != null && !configDir.isEmpty()) {
                            return configDir;
                        }
                    }
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to read wordhmm_data_directory from config: {}", e.getMessage());
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath() {
        return resolveDbPath(resolveDataDirectory());
    }

    public static String resolveDbPath(String dataDir) {
        return dataDir + File.separator + "wordhmm_cache.db";
    }
}
