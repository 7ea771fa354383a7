/**
 * Service layer: the language-model scorer and the beam search built on it.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.alphabet} - Label sets of the acoustic model (character and UTF-8 byte)</li>
 *   <li>{@code service.lm} - ARPA parsing and the binary backoff n-gram model</li>
 *   <li>{@code service.dictionary} - Vocabulary automaton compiled from the language model words</li>
 *   <li>{@code service.scorer} - Scorer package load/save and language-model queries</li>
 *   <li>{@code service.trie} - Prefix tree of beam search hypotheses</li>
 *   <li>{@code service.decoder} - CTC prefix beam search</li>
 *   <li>{@code service.acoustic} - Streaming front end over an acoustic model</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>A loaded {@link com.phillippitts.ctcdecode.service.scorer.Scorer} is shared by all streams
 *       and only read while decoding</li>
 *   <li>Per-stream state (prefix tree, beam) is never shared</li>
 *   <li>Load and persistence failures surface as
 *       {@link com.phillippitts.ctcdecode.exception.ScorerException} with a stable error code</li>
 * </ul>
 *
 * @see com.phillippitts.ctcdecode.service.scorer
 * @see com.phillippitts.ctcdecode.service.decoder
 * @since 1.0
 */
package com.phillippitts.ctcdecode.service;
