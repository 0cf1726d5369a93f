package com.wordhmm.server.ai.emission;

/**
 * Source of per-frame emission log-likelihoods over the full phone inventory.
 */
public interface EmissionProvider {
    String getProviderType();

    String getProviderVersion();

    /**
     * @return T x L matrix, entry [t][c] = log p(frame t | phone class c) up to a constant
     */
    double[][] computeLogLikelihoods(String utteranceId);
}
