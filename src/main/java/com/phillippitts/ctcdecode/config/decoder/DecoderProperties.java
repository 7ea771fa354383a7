package com.phillippitts.ctcdecode.config.decoder;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Beam search settings bound to {@code decoder.*}.
 *
 * <p>Example application.properties:
 * <pre>
 * decoder.beam-width=500
 * decoder.cutoff-prob=1.0
 * decoder.cutoff-top-n=40
 * decoder.num-results=1
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "decoder")
public class DecoderProperties {

    public static final int DEFAULT_BEAM_WIDTH = 500;
    public static final double DEFAULT_CUTOFF_PROB = 1.0;
    public static final int DEFAULT_CUTOFF_TOP_N = 40;

    /** Hypotheses kept after each frame. */
    @Min(1)
    private final int beamWidth;

    /**
     * Cumulative probability mass of the labels considered per frame. 1.0 disables the
     * cutoff and keeps the top {@code cutoffTopN} labels.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double cutoffProb;

    @Min(1)
    private final int cutoffTopN;

    @Min(1)
    private final int numResults;

    @ConstructorBinding
    public DecoderProperties(Integer beamWidth, Double cutoffProb, Integer cutoffTopN, Integer numResults) {
        this.beamWidth = beamWidth == null ? DEFAULT_BEAM_WIDTH : beamWidth;
        this.cutoffProb = cutoffProb == null ? DEFAULT_CUTOFF_PROB : cutoffProb;
        this.cutoffTopN = cutoffTopN == null ? DEFAULT_CUTOFF_TOP_N : cutoffTopN;
        this.numResults = numResults == null ? 1 : numResults;
    }

    /**
     * Defaults for everything but the beam width.
     */
    public DecoderProperties(int beamWidth) {
        this(beamWidth, null, null, null);
    }

    public int getBeamWidth() {
        return beamWidth;
    }

    public double getCutoffProb() {
        return cutoffProb;
    }

    public int getCutoffTopN() {
        return cutoffTopN;
    }

    public int getNumResults() {
        return numResults;
    }
}
