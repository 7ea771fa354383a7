package com.phillippitts.ctcdecode.service.health;

import com.phillippitts.ctcdecode.service.dictionary.VocabularyAutomaton;
import com.phillippitts.ctcdecode.service.lm.LanguageModel;
import com.phillippitts.ctcdecode.service.scorer.Scorer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScorerHealthIndicatorTest {

    @SuppressWarnings("unchecked")
    private static ScorerHealthIndicator indicatorFor(Scorer scorer) {
        ObjectProvider<Scorer> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(scorer);
        return new ScorerHealthIndicator(provider);
    }

    @Test
    void shouldReportUpWhenScorerDisabled() {
        Health health = indicatorFor(null).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Scorer disabled");
    }

    @Test
    void shouldReportDownWhenDictionaryMissing() {
        Scorer scorer = mock(Scorer.class);
        when(scorer.languageModel()).thenReturn(mock(LanguageModel.class));
        when(scorer.dictionary()).thenReturn(null);

        Health health = indicatorFor(scorer).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Scorer not loaded");
    }

    @Test
    void shouldReportWeightsWhenLoaded() {
        Scorer scorer = mock(Scorer.class);
        VocabularyAutomaton dictionary = mock(VocabularyAutomaton.class);
        when(dictionary.numStates()).thenReturn(42);
        when(scorer.languageModel()).thenReturn(mock(LanguageModel.class));
        when(scorer.dictionary()).thenReturn(dictionary);
        when(scorer.alpha()).thenReturn(0.93);
        when(scorer.beta()).thenReturn(1.18);
        when(scorer.maxOrder()).thenReturn(5);
        when(scorer.isUtf8Mode()).thenReturn(false);

        Health health = indicatorFor(scorer).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("status", "Scorer loaded")
                .containsEntry("alpha", 0.93)
                .containsEntry("beta", 1.18)
                .containsEntry("maxOrder", 5)
                .containsEntry("utf8Mode", false)
                .containsEntry("dictionaryStates", 42);
    }
}
