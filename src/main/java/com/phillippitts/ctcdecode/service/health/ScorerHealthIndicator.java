package com.phillippitts.ctcdecode.service.health;

import com.phillippitts.ctcdecode.service.dictionary.VocabularyAutomaton;
import com.phillippitts.ctcdecode.service.scorer.Scorer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the external scorer is loaded and with which settings.
 *
 * <p>A disabled scorer is healthy: streams then decode on acoustic scores alone.
 * Exposed via /actuator/health endpoint.
 */
@Component
public class ScorerHealthIndicator implements HealthIndicator {

    private final ObjectProvider<Scorer> scorerProvider;

    public ScorerHealthIndicator(ObjectProvider<Scorer> scorerProvider) {
        this.scorerProvider = scorerProvider;
    }

    @Override
    public Health health() {
        Scorer scorer = scorerProvider.getIfAvailable();
        if (scorer == null) {
            return Health.up()
                    .withDetail("status", "Scorer disabled")
                    .build();
        }

        VocabularyAutomaton dictionary = scorer.dictionary();
        if (scorer.languageModel() == null || dictionary == null) {
            return Health.down()
                    .withDetail("status", "Scorer not loaded")
                    .build();
        }

        return Health.up()
                .withDetail("status", "Scorer loaded")
                .withDetail("alpha", scorer.alpha())
                .withDetail("beta", scorer.beta())
                .withDetail("maxOrder", scorer.maxOrder())
                .withDetail("utf8Mode", scorer.isUtf8Mode())
                .withDetail("dictionaryStates", dictionary.numStates())
                .build();
    }
}
