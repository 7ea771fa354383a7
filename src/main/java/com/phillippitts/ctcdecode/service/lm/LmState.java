package com.phillippitts.ctcdecode.service.lm;

import java.util.Arrays;

/**
 * Language-model context: the word ids the next word is conditioned on, oldest first.
 * Never longer than {@code order - 1}.
 */
public final class LmState {

    private static final LmState EMPTY = new LmState(new int[0]);

    private final int[] words;

    private LmState(int[] words) {
        this.words = words;
    }

    public static LmState empty() {
        return EMPTY;
    }

    public static LmState of(int... words) {
        return words.length == 0 ? EMPTY : new LmState(words.clone());
    }

    public int length() {
        return words.length;
    }

    int[] words() {
        return words;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LmState other && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return "LmState" + Arrays.toString(words);
    }
}
