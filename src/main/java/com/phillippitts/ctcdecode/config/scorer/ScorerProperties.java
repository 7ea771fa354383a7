package com.phillippitts.ctcdecode.config.scorer;

import com.phillippitts.ctcdecode.service.lm.LoadMethod;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * External scorer settings bound to {@code scorer.*}.
 *
 * <p>Example application.properties:
 * <pre>
 * scorer.enabled=true
 * scorer.path=models/kenlm.scorer
 * scorer.alphabet-path=models/alphabet.txt
 * scorer.load-method=LAZY
 * scorer.alpha=0.93
 * scorer.beta=1.18
 * </pre>
 * {@code alpha} and {@code beta} override the weights stored in the package when set.
 */
@Validated
@ConfigurationProperties(prefix = "scorer")
public class ScorerProperties {

    public static final int DEFAULT_DETERMINIZE_WORK_LIMIT = 10_000_000;

    private final boolean enabled;

    /** Scorer package file. Required when enabled. */
    private final String path;

    /** Alphabet config file; blank selects the UTF-8 byte alphabet. */
    private final String alphabetPath;

    @NotNull
    private final LoadMethod loadMethod;

    private final Double alpha;
    private final Double beta;

    @Positive
    private final int determinizeWorkLimit;

    @ConstructorBinding
    public ScorerProperties(Boolean enabled, String path, String alphabetPath, LoadMethod loadMethod,
                            Double alpha, Double beta, Integer determinizeWorkLimit) {
        this.enabled = enabled != null && enabled;
        this.path = path;
        this.alphabetPath = alphabetPath;
        this.loadMethod = loadMethod == null ? LoadMethod.LAZY : loadMethod;
        this.alpha = alpha;
        this.beta = beta;
        this.determinizeWorkLimit = determinizeWorkLimit == null ? DEFAULT_DETERMINIZE_WORK_LIMIT : determinizeWorkLimit;
    }

    /**
     * Enabled scorer at {@code path} with every other setting defaulted.
     */
    public ScorerProperties(String path, String alphabetPath) {
        this(true, path, alphabetPath, null, null, null, null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getPath() {
        return path;
    }

    public String getAlphabetPath() {
        return alphabetPath;
    }

    public LoadMethod getLoadMethod() {
        return loadMethod;
    }

    /** Weight override, or null to keep the package value. */
    public Double getAlpha() {
        return alpha;
    }

    /** Bonus override, or null to keep the package value. */
    public Double getBeta() {
        return beta;
    }

    public int getDeterminizeWorkLimit() {
        return determinizeWorkLimit;
    }
}
