/**
 * Immutable results produced by decoding streams.
 *
 * <ul>
 *   <li>{@link com.phillippitts.ctcdecode.domain.CandidateTranscript} - one ranked hypothesis</li>
 *   <li>{@link com.phillippitts.ctcdecode.domain.TokenMetadata} - per-label text and timestep</li>
 * </ul>
 */
package com.phillippitts.ctcdecode.domain;
