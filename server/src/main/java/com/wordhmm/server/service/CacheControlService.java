package com.wordhmm.server.service;

import com.wordhmm.db.EmissionResultDao;
import com.wordhmm.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;

@Service
public class CacheControlService {

    private static final Logger logger = LoggerFactory.getLogger(CacheControlService.class);

    private final EmissionResultDao resultDao;

    public CacheControlService() {
        this(DataPathResolver.resolveDbPath());
    }

    public CacheControlService(String dbPath) {
        this.resultDao = new EmissionResultDao(dbPath);
    }

    /**
     * Clears all cached emissions for a specific provider type and version.
     * Use this when the acoustic front end or its model weights change.
     */
    public void clearProvider(String providerType, String providerVersion) {
        try {
            resultDao.deleteByProvider(providerType, providerVersion);
            logger.info("Cleared cached emissions for {}/{}", providerType, providerVersion);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear emission cache for " + providerType + "/" + providerVersion,
                    e);
        }
    }
}
