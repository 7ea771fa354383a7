package com.phillippitts.ctcdecode.service.lm;

/**
 * Result of scoring one word from a context.
 *
 * @param log10Prob conditional probability of the word, base-10 log
 * @param next      context to continue from after the word
 */
public record LmTransition(float log10Prob, LmState next) {
}
