package com.phillippitts.ctcdecode.service.lm;

import java.util.List;

/**
 * Conditional-probability capability of an n-gram language model.
 *
 * <p>Implementations are immutable once loaded and may be queried from any number of threads.
 * Scores are base-10 log probabilities, the native unit of ARPA models.
 */
public interface LanguageModel {

    /** Word id returned by {@link #index(String)} for words the model does not know. */
    int UNKNOWN_WORD = 0;

    /** Longest n-gram the model conditions on. */
    int order();

    /**
     * Byte offset at which the model's own serialized data ends inside its file.
     * Anything after it belongs to other readers.
     */
    long endOfModelOffset();

    /**
     * @return word id, or {@link #UNKNOWN_WORD} if the word is out of vocabulary
     */
    int index(String word);

    /** Word id of the end-of-sentence token. */
    int endSentence();

    /** Context right after the begin-of-sentence token. */
    LmState beginSentenceState();

    /** Unconditioned context. */
    LmState nullContextState();

    /**
     * Scores {@code word} following {@code state}.
     */
    LmTransition score(LmState state, int word);

    /** Words known to the model, in id order. */
    List<String> vocabulary();
}
