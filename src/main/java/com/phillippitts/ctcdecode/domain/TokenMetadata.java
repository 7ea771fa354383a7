package com.phillippitts.ctcdecode.domain;

import java.util.Objects;

/**
 * One emitted label of a transcript.
 *
 * @param text     label text (a character, or a raw byte in UTF-8 mode)
 * @param timestep frame index at which the label was emitted
 */
public record TokenMetadata(String text, int timestep) {

    public TokenMetadata {
        Objects.requireNonNull(text, "Token text must not be null");
        if (timestep < 0) {
            throw new IllegalArgumentException("Timestep must not be negative, got: " + timestep);
        }
    }
}
