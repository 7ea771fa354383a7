package com.phillippitts.ctcdecode.config.scorer;

import com.phillippitts.ctcdecode.exception.ScorerError;
import com.phillippitts.ctcdecode.exception.ScorerExceptionBuilder;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.alphabet.Utf8Alphabet;
import com.phillippitts.ctcdecode.service.scorer.Scorer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the alphabet and, when {@code scorer.enabled=true}, a loaded {@link Scorer}.
 *
 * <p>Load failures abort startup: a scorer that is configured but unusable is an error, not
 * a silent fallback to acoustic-only decoding.
 */
@Configuration
public class ScorerConfig {

    private static final Logger LOG = LogManager.getLogger(ScorerConfig.class);

    @Bean
    public Alphabet alphabet(ScorerProperties properties) {
        String alphabetPath = properties.getAlphabetPath();
        if (alphabetPath == null || alphabetPath.isBlank()) {
            LOG.info("No alphabet configured; using the UTF-8 byte alphabet");
            return new Utf8Alphabet();
        }
        Alphabet alphabet = Alphabet.fromConfig(Path.of(alphabetPath));
        LOG.info("Loaded alphabet '{}' with {} labels", alphabetPath, alphabet.size());
        return alphabet;
    }

    @Bean
    @ConditionalOnProperty(prefix = "scorer", name = "enabled", havingValue = "true")
    public Scorer scorer(ScorerProperties properties, Alphabet alphabet) {
        String path = properties.getPath();
        if (path == null || path.isBlank()) {
            throw ScorerExceptionBuilder.create(ScorerError.FILE_UNREADABLE, "scorer.path must be set when the scorer is enabled")
                    .build();
        }
        Scorer scorer = new Scorer(properties.getLoadMethod(), properties.getDeterminizeWorkLimit());
        scorer.init(Path.of(path), alphabet);

        if (properties.getAlpha() != null || properties.getBeta() != null) {
            double alpha = properties.getAlpha() != null ? properties.getAlpha() : scorer.alpha();
            double beta = properties.getBeta() != null ? properties.getBeta() : scorer.beta();
            scorer.resetParams(alpha, beta);
            LOG.info("Scorer weights overridden by configuration: alpha={}, beta={}", alpha, beta);
        }
        return scorer;
    }
}
