package com.phillippitts.ctcdecode.service.dictionary;

import java.nio.ByteBuffer;

/**
 * Deterministic acceptor over character-map symbols that constrains which label sequences
 * may continue a hypothesis.
 *
 * <p>Implementations must be immutable once built so a single instance can be shared by
 * every concurrently decoding stream.
 */
public interface VocabularyAutomaton {

    /** Value returned by {@link #step(int, int)} when no transition exists. */
    int NO_STATE = -1;

    int start();

    /**
     * Follows the transition labelled {@code symbol} out of {@code state}.
     *
     * @return destination state, or {@link #NO_STATE}
     */
    int step(int state, int symbol);

    boolean isAccept(int state);

    int numStates();

    /**
     * Runs the whole symbol sequence from the start state.
     *
     * @param symbols input symbols
     * @return true if the sequence ends in an accepting state
     */
    default boolean accepts(int[] symbols) {
        int state = start();
        for (int symbol : symbols) {
            state = step(state, symbol);
            if (state == NO_STATE) {
                return false;
            }
        }
        return isAccept(state);
    }

    /**
     * Serializes the automaton into a little-endian buffer positioned at 0.
     */
    ByteBuffer serialize();
}
