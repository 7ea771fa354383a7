package com.phillippitts.ctcdecode.testutil;

import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.scorer.ScorerPackageBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Test fixtures: the tiny trigram model and its alphabet, copied out of the test classpath.
 *
 * <p>The model knows {@code a, cat, cats, dog, zebra}; the alphabet spells every word but
 * {@code zebra}.
 */
public final class TestModels {

    public static final String ARPA = "/fixtures/tiny.arpa";
    public static final String ALPHABET = "/fixtures/alphabet.txt";

    public static final double ALPHA = 0.75;
    public static final double BETA = 1.85;

    private TestModels() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Copies a classpath resource into {@code dir}.
     *
     * @param resource classpath-relative path (e.g. "/fixtures/tiny.arpa")
     * @param dir      target directory
     * @return copied file
     * @throws IOException if the resource is missing or cannot be copied
     */
    public static Path copyResource(String resource, Path dir) throws IOException {
        try (InputStream in = TestModels.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Test resource not found: " + resource);
            }
            Path target = dir.resolve(resource.substring(resource.lastIndexOf('/') + 1));
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        }
    }

    public static Alphabet wordAlphabet(Path dir) throws IOException {
        return Alphabet.fromConfig(copyResource(ALPHABET, dir));
    }

    /**
     * Builds a word-mode scorer package from the tiny model with {@link #ALPHA} and {@link #BETA}.
     */
    public static Path buildWordPackage(Path dir) throws IOException {
        Path arpa = copyResource(ARPA, dir);
        Path output = dir.resolve("tiny.scorer");
        ScorerPackageBuilder.forAlphabet(wordAlphabet(dir))
                .alpha(ALPHA)
                .beta(BETA)
                .build(arpa, output);
        return output;
    }
}
