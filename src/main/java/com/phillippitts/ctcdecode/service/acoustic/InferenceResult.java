package com.phillippitts.ctcdecode.service.acoustic;

import java.util.Objects;

/**
 * Output of one {@link AcousticModel#infer} call.
 *
 * @param probs     row-major {@code [timeSteps][classCount]} probabilities
 * @param timeSteps output frames produced
 * @param stateC    cell state to pass to the next call
 * @param stateH    hidden state to pass to the next call
 */
public record InferenceResult(float[] probs, int timeSteps, float[] stateC, float[] stateH) {

    public InferenceResult {
        Objects.requireNonNull(probs, "probs");
        Objects.requireNonNull(stateC, "stateC");
        Objects.requireNonNull(stateH, "stateH");
        if (timeSteps < 0) {
            throw new IllegalArgumentException("timeSteps must not be negative: " + timeSteps);
        }
    }
}
