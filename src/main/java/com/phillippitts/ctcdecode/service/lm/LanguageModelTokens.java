package com.phillippitts.ctcdecode.service.lm;

import java.util.Set;

/**
 * Reserved pseudo-words of n-gram models. They never enter the vocabulary dictionary.
 */
public final class LanguageModelTokens {

    public static final String START = "<s>";
    public static final String END = "</s>";
    public static final String UNK = "<unk>";

    public static final Set<String> RESERVED = Set.of(START, END, UNK);

    private LanguageModelTokens() {
        // Constants holder - prevent instantiation
    }
}
