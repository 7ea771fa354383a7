/**
 * Configuration beans and properties.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.scorer} - Scorer package location, load method and weight overrides
 *       ({@code scorer.*})</li>
 *   <li>{@code config.decoder} - Beam search settings ({@code decoder.*})</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.ctcdecode.config;
