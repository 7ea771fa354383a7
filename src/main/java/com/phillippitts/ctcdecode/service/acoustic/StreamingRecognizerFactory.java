package com.phillippitts.ctcdecode.service.acoustic;

import com.phillippitts.ctcdecode.config.decoder.DecoderProperties;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.scorer.Scorer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opens {@link StreamingRecognizer}s that share the configured alphabet and scorer.
 *
 * <p>The scorer is optional: without a {@code Scorer} bean (or after
 * {@link #disableExternalScorer()}) streams decode on acoustic scores only.
 */
@Component
public class StreamingRecognizerFactory {

    private static final Logger LOG = LogManager.getLogger(StreamingRecognizerFactory.class);

    private final Alphabet alphabet;
    private final DecoderProperties decoderProperties;
    private final AtomicLong streamCounter = new AtomicLong();
    private volatile Scorer scorer;

    public StreamingRecognizerFactory(Alphabet alphabet, DecoderProperties decoderProperties,
                                      ObjectProvider<Scorer> scorerProvider) {
        this.alphabet = alphabet;
        this.decoderProperties = decoderProperties;
        this.scorer = scorerProvider.getIfAvailable();
    }

    /**
     * Opens a stream over the given model.
     *
     * @throws com.phillippitts.ctcdecode.exception.ScorerException if the model output does
     *         not match the alphabet
     */
    public StreamingRecognizer create(AcousticModel model) {
        String streamId = "stream-" + streamCounter.incrementAndGet();
        Scorer current = scorer;
        LOG.debug("Opening {} (scorer={})", streamId, current != null ? "enabled" : "disabled");
        return new StreamingRecognizer(streamId, model, alphabet, decoderProperties, current);
    }

    /**
     * Changes the scorer weights for streams decoded from now on. Must not be called while
     * streams are decoding.
     *
     * @throws IllegalStateException if no scorer is enabled
     */
    public void setScorerAlphaBeta(double alpha, double beta) {
        Scorer current = scorer;
        if (current == null) {
            throw new IllegalStateException("No external scorer enabled");
        }
        current.resetParams(alpha, beta);
        LOG.info("Scorer weights set to alpha={}, beta={}", alpha, beta);
    }

    /**
     * Stops using the external scorer for new streams.
     */
    public void disableExternalScorer() {
        scorer = null;
        LOG.info("External scorer disabled");
    }

    public boolean hasExternalScorer() {
        return scorer != null;
    }
}
