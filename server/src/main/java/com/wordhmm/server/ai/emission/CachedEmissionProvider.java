package com.wordhmm.server.ai.emission;

import com.wordhmm.db.EmissionResultDao;
import com.wordhmm.db.Utterance;
import com.wordhmm.db.UtteranceDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Keeps provider output in SQLite so that an utterance is only run through the
 * acoustic front end once per provider version.
 */
public class CachedEmissionProvider implements EmissionProvider {

    private static final Logger logger = LoggerFactory.getLogger(CachedEmissionProvider.class);

    private final EmissionProvider delegate;
    private final UtteranceDao utteranceDao;
    private final EmissionResultDao resultDao;

    public CachedEmissionProvider(EmissionProvider delegate,
            UtteranceDao utteranceDao,
            EmissionResultDao resultDao) {
        this.delegate = delegate;
        this.utteranceDao = utteranceDao;
        this.resultDao = resultDao;
    }

    @Override
    public String getProviderType() {
        return delegate.getProviderType();
    }

    @Override
    public String getProviderVersion() {
        return delegate.getProviderVersion();
    }

    @Override
    public double[][] computeLogLikelihoods(String utteranceId) {
        try {
            String type = delegate.getProviderType();
            String version = delegate.getProviderVersion();
            Optional<Utterance> known = utteranceDao.findByPath(utteranceId);

            if (known.isPresent()) {
                Optional<double[][]> cached = resultDao.loadLikelihoods(known.get().getId(), type, version);
                if (cached.isPresent()) {
                    logger.debug("Cache HIT for utterance {} provider {}/{}", utteranceId, type, version);
                    return cached.get();
                }
            }

            logger.debug("Cache MISS for utterance {} provider {}/{}", utteranceId, type, version);
            // Rejected ids never reach the utterance table
            double[][] likelihoods = delegate.computeLogLikelihoods(utteranceId);

            Utterance utterance = known.isPresent() ? known.get() : utteranceDao.getOrCreateByPath(utteranceId, null);
            resultDao.upsertLikelihoods(utterance.getId(), type, version, likelihoods);

            return likelihoods;

        } catch (SQLException e) {
            logger.error("Database error in CachedEmissionProvider, falling back to direct computation", e);
            return delegate.computeLogLikelihoods(utteranceId);
        }
    }
}
