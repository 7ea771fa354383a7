package com.phillippitts.ctcdecode.service.scorer;

import com.phillippitts.ctcdecode.exception.ScorerError;
import com.phillippitts.ctcdecode.exception.ScorerException;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.alphabet.CharacterMap;
import com.phillippitts.ctcdecode.service.alphabet.Utf8Alphabet;
import com.phillippitts.ctcdecode.service.lm.ArpaReader;
import com.phillippitts.ctcdecode.service.lm.BackoffLanguageModel;
import com.phillippitts.ctcdecode.service.lm.LoadMethod;
import com.phillippitts.ctcdecode.service.lm.NgramModelWriter;
import com.phillippitts.ctcdecode.testutil.TestModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScorerPackageTest {

    @TempDir
    Path tempDir;

    private Alphabet alphabet;
    private Path scorerPackage;
    private int modelEnd;

    @BeforeEach
    void setUp() throws IOException {
        alphabet = TestModels.wordAlphabet(tempDir);
        scorerPackage = TestModels.buildWordPackage(tempDir);
        modelEnd = (int) BackoffLanguageModel.load(scorerPackage, LoadMethod.LAZY).endOfModelOffset();
    }

    private Scorer load(Path path) {
        Scorer scorer = new Scorer();
        scorer.init(path, alphabet);
        return scorer;
    }

    private Path patched(String name, int offset, int value) throws IOException {
        byte[] bytes = Files.readAllBytes(scorerPackage);
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putInt(offset, value);
        Path target = tempDir.resolve(name);
        Files.write(target, bytes);
        return target;
    }

    private Path truncated(String name, int length) throws IOException {
        Path target = tempDir.resolve(name);
        Files.write(target, Arrays.copyOf(Files.readAllBytes(scorerPackage), length));
        return target;
    }

    private static ScorerError errorOf(Throwable e) {
        return ((ScorerException) e).getError();
    }

    @ParameterizedTest
    @EnumSource(LoadMethod.class)
    void packageRoundTripsWeightsDictionaryAndModel(LoadMethod method) {
        Scorer scorer = new Scorer(method, Scorer.DEFAULT_DETERMINIZE_WORK_LIMIT);
        scorer.init(scorerPackage, alphabet);

        assertThat(scorer.alpha()).isEqualTo(TestModels.ALPHA);
        assertThat(scorer.beta()).isEqualTo(TestModels.BETA);
        assertThat(scorer.isUtf8Mode()).isFalse();
        assertThat(scorer.maxOrder()).isEqualTo(3);

        CharacterMap map = new CharacterMap(alphabet);
        assertThat(scorer.dictionary().accepts(map.toSymbols("cat"))).isTrue();
        assertThat(scorer.dictionary().accepts(map.toSymbols("a dog"))).isTrue();
        assertThat(scorer.dictionary().accepts(map.toSymbols("ca"))).isFalse();
        assertThat(scorer.getLogCondProb(List.of("a", "cat"), true, false))
                .isCloseTo(-0.2 / Scorer.NUM_FLT_LOGE, within(1e-5));
    }

    @Test
    void initReadsAlphabetConfigFile() throws IOException {
        Scorer scorer = new Scorer();
        scorer.init(scorerPackage, TestModels.copyResource(TestModels.ALPHABET, tempDir));

        assertThat(scorer.alphabet().size()).isEqualTo(alphabet.size());
        assertThat(scorer.dictionary()).isNotNull();
    }

    @Test
    void utf8PackageSwitchesScorerToByteAlphabet() throws IOException {
        Path arpa = TestModels.copyResource(TestModels.ARPA, tempDir);
        Path utf8Package = tempDir.resolve("bytes.scorer");
        ScorerPackageBuilder.forAlphabet(new Utf8Alphabet()).alpha(0.5).beta(1.0).build(arpa, utf8Package);

        Scorer scorer = load(utf8Package);

        assertThat(scorer.isUtf8Mode()).isTrue();
        assertThat(scorer.alphabet()).isInstanceOf(Utf8Alphabet.class);
        assertThat(scorer.alpha()).isEqualTo(0.5);
    }

    @Test
    void explicitVocabularyRestrictsDictionary() throws IOException {
        Path arpa = TestModels.copyResource(TestModels.ARPA, tempDir);
        Path output = tempDir.resolve("dogs.scorer");

        Scorer built = ScorerPackageBuilder.forAlphabet(alphabet)
                .vocabulary(List.of("dog"))
                .determinizeWorkLimit(1_000)
                .build(arpa, output);
        Scorer loaded = load(output);

        CharacterMap map = new CharacterMap(alphabet);
        assertThat(built.dictionary().accepts(map.toSymbols("dog"))).isTrue();
        assertThat(loaded.dictionary().accepts(map.toSymbols("dog"))).isTrue();
        assertThat(loaded.dictionary().accepts(map.toSymbols("cat"))).isFalse();
    }

    @Test
    void dictionarySavedOnItsOwnLoadsThroughLoadTrie() throws IOException {
        Scorer source = load(scorerPackage);
        Path standalone = tempDir.resolve("dictionary.bin");
        Files.write(standalone, new byte[]{9, 9, 9});
        source.saveDictionary(standalone, false);

        Scorer target = new Scorer(alphabet, source.languageModel(), false);
        try (FileChannel channel = FileChannel.open(standalone, StandardOpenOption.READ)) {
            target.loadTrie(channel, standalone);
        }

        CharacterMap map = new CharacterMap(alphabet);
        assertThat(target.parameters()).isEqualTo(source.parameters());
        assertThat(target.isUtf8Mode()).isEqualTo(source.isUtf8Mode());
        assertThat(target.dictionary().numStates()).isEqualTo(source.dictionary().numStates());
        for (String text : List.of("cat", "cats", "dog", "a cat", "ca", "dogs", "tac")) {
            assertThat(target.dictionary().accepts(map.toSymbols(text)))
                    .as(text)
                    .isEqualTo(source.dictionary().accepts(map.toSymbols(text)));
        }
    }

    @Test
    void wrongMagicIsCorruptHeader() throws IOException {
        Path broken = patched("magic.scorer", modelEnd, 0x12345678);

        assertThatThrownBy(() -> load(broken))
                .isInstanceOf(ScorerException.class)
                .hasMessageContaining("Try updating your scorer file.")
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.CORRUPT_PACKAGE_HEADER));
    }

    @Test
    void newerVersionAsksToDowngrade() throws IOException {
        Path newer = patched("newer.scorer", modelEnd + Integer.BYTES, Scorer.FILE_VERSION + 1);

        assertThatThrownBy(() -> load(newer))
                .isInstanceOf(ScorerException.class)
                .hasMessageContaining("Downgrade your scorer file")
                .hasMessageContaining("found=" + (Scorer.FILE_VERSION + 1))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.VERSION_MISMATCH));
    }

    @Test
    void olderVersionAsksToUpdate() throws IOException {
        Path older = patched("older.scorer", modelEnd + Integer.BYTES, Scorer.FILE_VERSION - 1);

        assertThatThrownBy(() -> load(older))
                .isInstanceOf(ScorerException.class)
                .hasMessageContaining("Update your scorer file.")
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.VERSION_MISMATCH));
    }

    @Test
    void truncatedHeaderIsCorrupt() throws IOException {
        Path shortHeader = truncated("short.scorer", modelEnd + 10);

        assertThatThrownBy(() -> load(shortHeader))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.CORRUPT_PACKAGE_HEADER));
    }

    @Test
    void truncatedDictionaryIsCorrupt() throws IOException {
        int size = (int) Files.size(scorerPackage);
        Path shortDictionary = truncated("dict.scorer", size - Integer.BYTES);

        assertThatThrownBy(() -> load(shortDictionary))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.CORRUPT_PACKAGE_HEADER));
    }

    @Test
    void dictionaryTransitionOutOfRangeIsCorrupt() throws IOException {
        int dictionaryStart = modelEnd + 25;
        ByteBuffer header = ByteBuffer.wrap(Files.readAllBytes(scorerPackage)).order(ByteOrder.LITTLE_ENDIAN);
        int numStates = header.getInt(dictionaryStart);
        int numTransitions = header.getInt(dictionaryStart + Integer.BYTES);
        int firstDest = dictionaryStart + (3 + numStates + 1 + 2 * numTransitions) * Integer.BYTES;
        Path broken = patched("dest.scorer", firstDest, numStates + 5);

        assertThatThrownBy(() -> load(broken))
                .isInstanceOf(ScorerException.class)
                .hasMessageContaining("dictionary is malformed")
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.CORRUPT_PACKAGE_HEADER));
    }

    @Test
    void modelWithoutPackageIsMissingPackage() throws IOException {
        Path modelOnly = tempDir.resolve("model-only.bin");
        NgramModelWriter.write(ArpaReader.read(TestModels.copyResource(TestModels.ARPA, tempDir)), modelOnly);

        assertThatThrownBy(() -> load(modelOnly))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.MISSING_PACKAGE));
    }

    @Test
    void textFileIsInvalidFormat() throws IOException {
        Path arpa = TestModels.copyResource(TestModels.ARPA, tempDir);

        assertThatThrownBy(() -> load(arpa))
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.INVALID_FORMAT));
    }

    @Test
    void missingFileIsUnreadable() {
        Path missing = tempDir.resolve("nope.scorer");

        assertThatThrownBy(() -> load(missing))
                .isInstanceOf(ScorerException.class)
                .hasMessageContaining("nope.scorer")
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.FILE_UNREADABLE));
    }

    @Test
    void unwritableTargetIsPersistFailure() {
        Scorer scorer = load(scorerPackage);
        Path directory = tempDir.resolve("is-a-directory");

        assertThatThrownBy(() -> {
            Files.createDirectory(directory);
            scorer.saveDictionary(directory, false);
        })
                .satisfies(e -> assertThat(errorOf(e)).isEqualTo(ScorerError.PERSIST_FAILURE));
    }
}
