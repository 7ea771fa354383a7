package com.phillippitts.ctcdecode.service.acoustic;

import com.phillippitts.ctcdecode.config.decoder.DecoderProperties;
import com.phillippitts.ctcdecode.domain.CandidateTranscript;
import com.phillippitts.ctcdecode.exception.ScorerError;
import com.phillippitts.ctcdecode.exception.ScorerException;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StreamingRecognizerTest {

    private static final int STATE_SIZE = 2;

    private Alphabet alphabet;
    private AcousticModel model;
    private int classes;

    @BeforeEach
    void setUp() {
        alphabet = Alphabet.fromConfigLines(List.of(" ", "a", "c", "d", "g", "o", "s", "t"));
        classes = alphabet.size() + 1;
        model = mock(AcousticModel.class);
        when(model.classCount()).thenReturn(classes);
        when(model.stateSize()).thenReturn(STATE_SIZE);
    }

    private float[] peaks(String text) {
        float[] probs = new float[text.length() * classes];
        for (int i = 0; i < text.length(); i++) {
            Arrays.fill(probs, i * classes, (i + 1) * classes, 0.1f / (classes - 1));
            probs[i * classes + alphabet.labelFromString(text.substring(i, i + 1))] = 0.9f;
        }
        return probs;
    }

    private InferenceResult result(String text, float stateValue) {
        float[] state = new float[STATE_SIZE];
        Arrays.fill(state, stateValue);
        return new InferenceResult(peaks(text), text.length(), state, state.clone());
    }

    private StreamingRecognizer open() {
        return new StreamingRecognizer("stream-test", model, alphabet, new DecoderProperties(10), null);
    }

    @Test
    void rejectsModelThatDoesNotMatchAlphabet() {
        when(model.classCount()).thenReturn(classes + 1);

        assertThatThrownBy(this::open)
                .isInstanceOf(ScorerException.class)
                .satisfies(e -> assertThat(((ScorerException) e).getError()).isEqualTo(ScorerError.INVALID_ALPHABET_SIZE));
    }

    @Test
    void decodesAcrossFeedsAndCarriesRecurrentState() {
        InferenceResult first = result("ca", 0.5f);
        InferenceResult second = result("t", 0.7f);
        when(model.infer(any(), anyInt(), any(), any())).thenReturn(first, second);
        float[] frames = new float[8];

        StreamingRecognizer stream = open();
        stream.feedFrames(frames, 2);
        assertThat(stream.intermediateDecode().text()).isEqualTo("ca");
        stream.feedFrames(frames, 1);

        verify(model).infer(same(frames), eq(1), same(first.stateC()), same(first.stateH()));
        List<CandidateTranscript> results = stream.finishStream();
        assertThat(results).hasSize(1);
        assertThat(results.get(0).text()).isEqualTo("cat");
    }

    @Test
    void firstFeedStartsFromZeroState() {
        when(model.infer(any(), anyInt(), any(), any())).thenAnswer(invocation -> {
            float[] stateC = invocation.getArgument(2);
            float[] stateH = invocation.getArgument(3);
            assertThat(stateC).containsOnly(0.0f).hasSize(STATE_SIZE);
            assertThat(stateH).containsOnly(0.0f).hasSize(STATE_SIZE);
            return result("d", 0.1f);
        });

        StreamingRecognizer stream = open();
        stream.feedFrames(new float[4], 1);

        assertThat(stream.intermediateDecode(3)).isNotEmpty();
    }

    @Test
    void finishClosesTheStream() {
        when(model.infer(any(), anyInt(), any(), any())).thenReturn(result("a", 0.0f));
        StreamingRecognizer stream = open();
        stream.feedFrames(new float[4], 1);

        stream.finishStream(2);

        assertThat(stream.isClosed()).isTrue();
        assertThatThrownBy(() -> stream.feedFrames(new float[4], 1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("stream-test");
        assertThatThrownBy(stream::intermediateDecode).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shortModelOutputIsRejected() {
        when(model.infer(any(), anyInt(), any(), any()))
                .thenReturn(new InferenceResult(new float[classes], 2, new float[STATE_SIZE], new float[STATE_SIZE]));
        StreamingRecognizer stream = open();

        assertThatThrownBy(() -> stream.feedFrames(new float[4], 2))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("probabilities");
    }

    @Test
    void streamIdIsClearedFromThreadContextAfterFeed() {
        when(model.infer(any(), anyInt(), any(), any())).thenAnswer(invocation -> {
            assertThat(ThreadContext.get(StreamingRecognizer.STREAM_ID_KEY)).isEqualTo("stream-test");
            return result("o", 0.0f);
        });
        StreamingRecognizer stream = open();

        stream.feedFrames(new float[4], 1);

        assertThat(ThreadContext.get(StreamingRecognizer.STREAM_ID_KEY)).isNull();
    }
}
