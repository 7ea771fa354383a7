/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.ctcdecode.exception.CtcDecodeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.ctcdecode.exception.ScorerException} - Thrown when a scorer
 *       package cannot be loaded or written, or decoding setup is inconsistent; carries a
 *       {@link com.phillippitts.ctcdecode.exception.ScorerError} code</li>
 * </ul>
 *
 * <p>Scoring an out-of-vocabulary word is not an error: it yields a fixed penalty score.
 *
 * @see com.phillippitts.ctcdecode.exception.ScorerExceptionBuilder
 * @since 1.0
 */
package com.phillippitts.ctcdecode.exception;
