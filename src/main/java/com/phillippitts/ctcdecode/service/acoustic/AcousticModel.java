package com.phillippitts.ctcdecode.service.acoustic;

/**
 * Recurrent acoustic model producing per-frame label probabilities.
 *
 * <p>Implementations wrap an inference runtime; the decoder only sees the returned
 * probabilities and carries the recurrent state from one call to the next.
 */
public interface AcousticModel {

    /** Labels per output frame, blank included. */
    int classCount();

    /** Length of each recurrent state vector. */
    int stateSize();

    /**
     * Runs the model over a batch of feature frames.
     *
     * @param frames         feature frames, row-major
     * @param frameCount     number of frames in {@code frames}
     * @param previousStateC cell state from the previous call (zeros for a new stream)
     * @param previousStateH hidden state from the previous call (zeros for a new stream)
     * @return probabilities and the updated state
     */
    InferenceResult infer(float[] frames, int frameCount, float[] previousStateC, float[] previousStateH);
}
