package com.phillippitts.ctcdecode;

import com.phillippitts.ctcdecode.service.acoustic.StreamingRecognizerFactory;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.health.ScorerHealthIndicator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "scorer.enabled=false", // no scorer package needed for the context
        "scorer.alphabet-path="
    }
)
class CtcDecodeApplicationTests {

    @Autowired
    private StreamingRecognizerFactory recognizerFactory;

    @Autowired
    private Alphabet alphabet;

    @Autowired
    private ScorerHealthIndicator healthIndicator;

    @Test
    void contextLoads() {
        assertThat(recognizerFactory.hasExternalScorer()).isFalse();
        assertThat(alphabet.isUtf8()).isTrue();
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

}
