package com.phillippitts.ctcdecode.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable decoding hypothesis returned by the beam search.
 *
 * <p>Confidence is the hypothesis' acoustic log probability: the language-model weight and
 * word insertion bonus are removed before it is reported, so values from different scorer
 * settings stay comparable. It is not bounded to [0, 1].
 *
 * @param text       decoded text (empty for silence)
 * @param tokens     emitted labels in order
 * @param confidence acoustic log probability, higher is better
 */
public record CandidateTranscript(String text, List<TokenMetadata> tokens, double confidence) {

    public CandidateTranscript {
        Objects.requireNonNull(text, "Transcript text must not be null");
        tokens = List.copyOf(Objects.requireNonNull(tokens, "Tokens must not be null"));
    }
}
