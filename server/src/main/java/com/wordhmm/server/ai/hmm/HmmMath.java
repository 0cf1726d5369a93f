package com.wordhmm.server.ai.hmm;

public class HmmMath {

    /**
     * Computes log(sum(exp(x_i))) without overflow or underflow.
     * Uses the "max trick": logsumexp(x) = max(x) + log(sum(exp(x_i - max(x))))
     */
    public static double logSumExp(double[] x) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : x) {
            if (v > max)
                max = v;
        }
        if (max == Double.NEGATIVE_INFINITY) {
            return Double.NEGATIVE_INFINITY;
        }

        double sum = 0.0;
        for (double v : x) {
            sum += Math.exp(v - max);
        }
        return max + Math.log(sum);
    }

    /**
     * Returns the index of the maximum value in the array.
     * Ties resolve to the smallest index.
     */
    public static int argmax(double[] x) {
        int bestIdx = 0;
        double bestVal = x[0];
        for (int i = 1; i < x.length; i++) {
            if (x[i] > bestVal) {
                bestVal = x[i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }

    /**
     * Element-wise log(p + epsilon).
     */
    public static double[] flooredLog(double[] probs, double epsilon) {
        double[] logs = new double[probs.length];
        for (int i = 0; i < probs.length; i++) {
            logs[i] = Math.log(probs[i] + epsilon);
        }
        return logs;
    }

    /**
     * Inverse of {@link #flooredLog(double[], double)}: exp(value) - epsilon.
     */
    public static double[] unfloorExp(double[] logs, double epsilon) {
        double[] probs = new double[logs.length];
        for (int i = 0; i < logs.length; i++) {
            probs[i] = Math.exp(logs[i]) - epsilon;
        }
        return probs;
    }

    public static double[][] copyOf(double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }

    /**
     * Computes the maximum absolute difference between two matrices of equal shape.
     */
    public static double maxAbsDelta(double[][] a, double[][] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Matrices must have same number of rows");
        }
        double maxDelta = 0.0;
        for (int r = 0; r < a.length; r++) {
            if (a[r].length != b[r].length) {
                throw new IllegalArgumentException("Matrices must have same row lengths");
            }
            for (int c = 0; c < a[r].length; c++) {
                double delta = Math.abs(a[r][c] - b[r][c]);
                if (delta > maxDelta) {
                    maxDelta = delta;
                }
            }
        }
        return maxDelta;
    }
}
