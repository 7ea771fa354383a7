/**
 * External scorer: language model, vocabulary dictionary and fusion weights.
 *
 * <p>A scorer package is one file: a binary n-gram model followed by a 25-byte header
 * (magic, version, UTF-8 flag, alpha, beta) and the serialized dictionary.
 * {@link com.phillippitts.ctcdecode.service.scorer.ScorerPackageBuilder} writes packages,
 * {@link com.phillippitts.ctcdecode.service.scorer.Scorer#init} reads them.
 *
 * @since 1.0
 */
package com.phillippitts.ctcdecode.service.scorer;
