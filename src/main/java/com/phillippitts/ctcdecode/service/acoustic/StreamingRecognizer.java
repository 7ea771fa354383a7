package com.phillippitts.ctcdecode.service.acoustic;

import com.phillippitts.ctcdecode.config.decoder.DecoderProperties;
import com.phillippitts.ctcdecode.domain.CandidateTranscript;
import com.phillippitts.ctcdecode.exception.ScorerError;
import com.phillippitts.ctcdecode.exception.ScorerExceptionBuilder;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.decoder.DecoderState;
import com.phillippitts.ctcdecode.service.scorer.Scorer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.List;
import java.util.Objects;

/**
 * One speech stream: feeds feature frames through the acoustic model and into a beam search.
 *
 * <p>Recurrent state is carried between {@link #feedFrames} calls. Log lines written while
 * the stream works carry its id under the {@code streamId} ThreadContext key.
 *
 * <p>Not thread-safe; a stream is driven by one caller at a time.
 */
public class StreamingRecognizer implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(StreamingRecognizer.class);

    public static final String STREAM_ID_KEY = "streamId";

    private final String streamId;
    private final AcousticModel model;
    private final DecoderState decoder;
    private final int numResults;
    private float[] stateC;
    private float[] stateH;
    private boolean closed;

    /**
     * @param streamId   id used in logs
     * @param model      acoustic model
     * @param alphabet   alphabet matching the model output
     * @param properties beam settings
     * @param scorer     external scorer, or null
     * @throws com.phillippitts.ctcdecode.exception.ScorerException with
     *         {@link ScorerError#INVALID_ALPHABET_SIZE} if the model output does not match the alphabet
     */
    public StreamingRecognizer(String streamId, AcousticModel model, Alphabet alphabet,
                               DecoderProperties properties, Scorer scorer) {
        this.streamId = Objects.requireNonNull(streamId, "streamId");
        this.model = Objects.requireNonNull(model, "model");
        Objects.requireNonNull(alphabet, "alphabet");
        if (model.classCount() != alphabet.size() + 1) {
            throw ScorerExceptionBuilder.create(ScorerError.INVALID_ALPHABET_SIZE,
                            "Acoustic model output does not match the alphabet")
                    .metadata("classes", model.classCount())
                    .metadata("alphabetSize", alphabet.size())
                    .hint("The model needs an alphabet with one label fewer than its output classes.")
                    .build();
        }
        this.decoder = new DecoderState(alphabet, properties, scorer);
        this.numResults = properties.getNumResults();
        this.stateC = new float[model.stateSize()];
        this.stateH = new float[model.stateSize()];
    }

    /**
     * Runs inference over the frames and advances the beam search.
     *
     * @param frames     feature frames
     * @param frameCount number of frames
     */
    public void feedFrames(float[] frames, int frameCount) {
        ensureOpen();
        ThreadContext.put(STREAM_ID_KEY, streamId);
        try {
            InferenceResult result = model.infer(frames, frameCount, stateC, stateH);
            int classes = model.classCount();
            if (result.probs().length < (long) result.timeSteps() * classes) {
                throw new IllegalStateException("Acoustic model returned " + result.probs().length
                        + " probabilities for " + result.timeSteps() + " steps of " + classes + " classes");
            }
            stateC = result.stateC();
            stateH = result.stateH();
            decoder.next(result.probs(), result.timeSteps(), classes);
            LOG.debug("Fed {} frames, decoder at timestep {}", frameCount, decoder.timestep());
        } finally {
            ThreadContext.remove(STREAM_ID_KEY);
        }
    }

    /**
     * Best transcript so far; the stream stays open.
     */
    public CandidateTranscript intermediateDecode() {
        return intermediateDecode(1).get(0);
    }

    public List<CandidateTranscript> intermediateDecode(int results) {
        ensureOpen();
        return decoder.decode(results);
    }

    /**
     * Decodes the configured number of transcripts and closes the stream.
     */
    public List<CandidateTranscript> finishStream() {
        return finishStream(numResults);
    }

    public List<CandidateTranscript> finishStream(int results) {
        ensureOpen();
        ThreadContext.put(STREAM_ID_KEY, streamId);
        try {
            List<CandidateTranscript> transcripts = decoder.decode(results);
            LOG.info("Stream finished after {} timesteps with {} transcripts", decoder.timestep(), transcripts.size());
            return transcripts;
        } finally {
            ThreadContext.remove(STREAM_ID_KEY);
            close();
        }
    }

    public String streamId() {
        return streamId;
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Stream " + streamId + " is closed");
        }
    }

    @Override
    public void close() {
        closed = true;
    }
}
