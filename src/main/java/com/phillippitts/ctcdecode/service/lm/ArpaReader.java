package com.phillippitts.ctcdecode.service.lm;

import com.phillippitts.ctcdecode.exception.CtcDecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses ARPA-format backoff n-gram models.
 *
 * <p>Expected layout:
 * <pre>
 * \data\
 * ngram 1=4
 * ngram 2=3
 *
 * \1-grams:
 * -1.0  &lt;s&gt;  -0.3
 * ...
 * \end\
 * </pre>
 * Every word used by a higher-order n-gram must appear as a unigram. A missing {@code <unk>}
 * unigram is added with probability {@value #DEFAULT_UNK_LOG10_PROB}.
 */
public final class ArpaReader {

    private static final Logger LOG = LogManager.getLogger(ArpaReader.class);

    static final float DEFAULT_UNK_LOG10_PROB = -100.0f;

    private ArpaReader() {
        // Utility class - prevent instantiation
    }

    /**
     * Reads an ARPA file.
     *
     * @param path ARPA text file
     * @return parsed model
     * @throws CtcDecodeException if the file cannot be read or is malformed
     */
    public static ArpaModel read(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new CtcDecodeException("Failed to read ARPA file: " + path, e);
        }
    }

    static ArpaModel read(BufferedReader reader, String source) throws IOException {
        String line = skipTo(reader, "\\data\\", source);

        List<Long> counts = new ArrayList<>();
        while ((line = reader.readLine()) != null && !line.isBlank()) {
            counts.add(parseCountLine(line.trim(), counts.size() + 1, source));
        }
        if (counts.isEmpty()) {
            throw malformed(source, "no 'ngram N=count' lines after \\data\\");
        }
        int order = counts.size();

        List<String> vocabulary = new ArrayList<>();
        Map<String, Integer> ids = new HashMap<>();
        vocabulary.add(LanguageModelTokens.UNK);
        ids.put(LanguageModelTokens.UNK, LanguageModel.UNKNOWN_WORD);
        boolean unkSeen = false;

        List<List<ArpaModel.Entry>> ngrams = new ArrayList<>(order);
        for (int n = 1; n <= order; n++) {
            skipTo(reader, "\\" + n + "-grams:", source);
            List<ArpaModel.Entry> entries = new ArrayList<>();
            while ((line = reader.readLine()) != null && !line.isBlank()) {
                String[] fields = line.trim().split("\\s+");
                if (fields.length != n + 1 && fields.length != n + 2) {
                    throw malformed(source, "expected " + n + " words in line '" + line + "'");
                }
                float prob = parseFloat(fields[0], line, source);
                float backoff = fields.length == n + 2 ? parseFloat(fields[n + 1], line, source) : 0.0f;
                int[] words = new int[n];
                for (int i = 0; i < n; i++) {
                    String word = fields[i + 1];
                    Integer id = ids.get(word);
                    if (id == null) {
                        if (n > 1) {
                            throw malformed(source, "word '" + word + "' in " + n + "-gram is not a unigram");
                        }
                        id = vocabulary.size();
                        vocabulary.add(word);
                        ids.put(word, id);
                    } else if (n == 1 && id == LanguageModel.UNKNOWN_WORD) {
                        unkSeen = true;
                    }
                    words[i] = id;
                }
                entries.add(new ArpaModel.Entry(words, prob, backoff));
            }
            if (entries.size() != counts.get(n - 1)) {
                throw malformed(source, "header declares " + counts.get(n - 1) + " " + n
                        + "-grams but " + entries.size() + " were listed");
            }
            ngrams.add(entries);
        }
        skipTo(reader, "\\end\\", source);

        if (!unkSeen) {
            LOG.warn("ARPA model '{}' has no {} unigram; adding it with log10 probability {}",
                    source, LanguageModelTokens.UNK, DEFAULT_UNK_LOG10_PROB);
            ngrams.get(0).add(new ArpaModel.Entry(new int[]{LanguageModel.UNKNOWN_WORD},
                    DEFAULT_UNK_LOG10_PROB, 0.0f));
        }
        LOG.info("Parsed ARPA model '{}': order={}, vocabulary={} words", source, order, vocabulary.size());
        return new ArpaModel(order, vocabulary, ngrams);
    }

    private static String skipTo(BufferedReader reader, String marker, String source) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.trim().equals(marker)) {
                return line;
            }
        }
        throw malformed(source, "missing section marker " + marker);
    }

    private static long parseCountLine(String line, int expectedOrder, String source) {
        // ngram 2=1234
        if (!line.startsWith("ngram ")) {
            throw malformed(source, "unexpected header line '" + line + "'");
        }
        String[] parts = line.substring("ngram ".length()).split("=");
        if (parts.length != 2) {
            throw malformed(source, "unexpected header line '" + line + "'");
        }
        try {
            int n = Integer.parseInt(parts[0].trim());
            if (n != expectedOrder) {
                throw malformed(source, "n-gram counts out of order at '" + line + "'");
            }
            return Long.parseLong(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new CtcDecodeException("Malformed ARPA file " + source + ": bad count line '" + line + "'", e);
        }
    }

    private static float parseFloat(String value, String line, String source) {
        try {
            return Float.parseFloat(value);
        } catch (NumberFormatException e) {
            throw new CtcDecodeException("Malformed ARPA file " + source + ": bad number in line '" + line + "'", e);
        }
    }

    private static CtcDecodeException malformed(String source, String detail) {
        return new CtcDecodeException("Malformed ARPA file " + source + ": " + detail);
    }
}
