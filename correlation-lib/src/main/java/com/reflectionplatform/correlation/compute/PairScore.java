package com.reflectionplatform.correlation.compute;

/**
 * Pearson coefficient and confidence of one aligned sample set.
 *
 * @param coefficient Pearson r in [-1, 1]
 * @param confidence  1 - p of the test of zero correlation, in [0, 1]
 * @param sampleSize  number of aligned days scored
 */
public record PairScore(double coefficient, double confidence, int sampleSize) {

    public double strength() {
        return confidence * Math.abs(coefficient);
    }
}
