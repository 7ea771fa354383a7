package com.phillippitts.ctcdecode.service.scorer;

/**
 * Language-model fusion weights: {@code combined = acoustic + alpha * lm + beta * wordCount}.
 *
 * @param alpha language-model weight
 * @param beta  word insertion bonus
 */
public record ScorerParameters(double alpha, double beta) {

    public ScorerParameters {
        if (!Double.isFinite(alpha) || !Double.isFinite(beta)) {
            throw new IllegalArgumentException("alpha and beta must be finite: alpha=" + alpha + ", beta=" + beta);
        }
    }
}
