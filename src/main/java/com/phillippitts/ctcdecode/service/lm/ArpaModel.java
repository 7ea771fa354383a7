package com.phillippitts.ctcdecode.service.lm;

import java.util.List;

/**
 * In-memory n-gram model as parsed from an ARPA file, before it is written to binary form.
 *
 * @param order      highest n-gram order
 * @param vocabulary words in id order; id 0 is {@code <unk>}
 * @param ngrams     entries per order, index 0 holding unigrams
 */
public record ArpaModel(int order, List<String> vocabulary, List<List<Entry>> ngrams) {

    public ArpaModel {
        vocabulary = List.copyOf(vocabulary);
        ngrams = List.copyOf(ngrams);
    }

    /**
     * One n-gram line.
     *
     * @param words    word ids, oldest first
     * @param log10Prob probability, base-10 log
     * @param backoff  backoff weight, base-10 log (0 when absent)
     */
    public record Entry(int[] words, float log10Prob, float backoff) {
    }
}
