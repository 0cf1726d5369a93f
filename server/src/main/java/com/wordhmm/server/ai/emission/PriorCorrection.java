package com.wordhmm.server.ai.emission;

/**
 * Turns classifier log-posteriors into emission log-likelihoods by dividing out
 * the class prior: log p(x|c) ~ log p(c|x) - log p(c).
 */
public class PriorCorrection {

    /**
     * Applies a uniform prior over the row width, i.e. adds log(L) to every entry.
     */
    public static double[][] uniform(double[][] logPosteriors) {
        double[][] likelihoods = new double[logPosteriors.length][];
        for (int t = 0; t < logPosteriors.length; t++) {
            if (logPosteriors[t] == null) {
                throw new IllegalArgumentException("Posterior frame " + t + " is missing");
            }
            double logPrior = Math.log(1.0 / logPosteriors[t].length);
            likelihoods[t] = new double[logPosteriors[t].length];
            for (int c = 0; c < logPosteriors[t].length; c++) {
                likelihoods[t][c] = logPosteriors[t][c] - logPrior;
            }
        }
        return likelihoods;
    }
}
