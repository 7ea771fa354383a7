package com.phillippitts.ctcdecode.service.lm;

import com.phillippitts.ctcdecode.exception.ScorerError;
import com.phillippitts.ctcdecode.exception.ScorerExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Backoff n-gram model read from the binary layout of {@link NgramModelFormat}.
 *
 * <p>Scoring follows the usual ARPA backoff rule: the longest stored n-gram ending in the
 * word supplies the probability, plus the backoff weights of every longer context that
 * had to be dropped to find it.
 *
 * <p>Thread-safe: immutable after {@link #load(Path, LoadMethod)}.
 */
public final class BackoffLanguageModel implements LanguageModel {

    private static final Logger LOG = LogManager.getLogger(BackoffLanguageModel.class);

    private final int order;
    private final long endOffset;
    private final List<String> vocabulary;
    private final Map<String, Integer> wordIds;
    private final NgramTable[] tables;
    private final int beginSentence;
    private final int endSentence;

    private BackoffLanguageModel(int order, long endOffset, List<String> vocabulary, NgramTable[] tables) {
        this.order = order;
        this.endOffset = endOffset;
        this.vocabulary = List.copyOf(vocabulary);
        this.tables = tables;
        Map<String, Integer> ids = new HashMap<>(vocabulary.size() * 2);
        for (int i = 0; i < vocabulary.size(); i++) {
            ids.put(vocabulary.get(i), i);
        }
        this.wordIds = ids;
        this.beginSentence = ids.getOrDefault(LanguageModelTokens.START, UNKNOWN_WORD);
        this.endSentence = ids.getOrDefault(LanguageModelTokens.END, UNKNOWN_WORD);
    }

    /**
     * Loads a binary model.
     *
     * @param path   model file (may carry trailing data after the model)
     * @param method {@link LoadMethod#LAZY} keeps tables memory-mapped,
     *               {@link LoadMethod#READ} copies them onto the heap
     * @return loaded model
     * @throws IOException if the file cannot be read
     * @throws com.phillippitts.ctcdecode.exception.ScorerException with
     *         {@link ScorerError#INVALID_FORMAT} if the content is not a valid model
     */
    public static BackoffLanguageModel load(Path path, LoadMethod method) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long fileSize = channel.size();
            if (fileSize > Integer.MAX_VALUE) {
                throw ScorerExceptionBuilder.create(ScorerError.INVALID_FORMAT, "Language model file too large to map")
                        .path(path)
                        .metadata("bytes", fileSize)
                        .build();
            }
            ByteBuffer buffer = channel.map(FileChannel.MapMode.READ_ONLY, 0, fileSize)
                    .order(ByteOrder.LITTLE_ENDIAN);
            try {
                return parse(buffer, method, path);
            } catch (BufferUnderflowException | IndexOutOfBoundsException e) {
                throw ScorerExceptionBuilder.create(ScorerError.INVALID_FORMAT, "Language model data is truncated")
                        .path(path)
                        .cause(e)
                        .build();
            }
        }
    }

    private static BackoffLanguageModel parse(ByteBuffer buffer, LoadMethod method, Path path) {
        byte[] signature = new byte[NgramModelFormat.SIGNATURE.length];
        buffer.get(signature);
        if (!Arrays.equals(signature, NgramModelFormat.SIGNATURE)) {
            throw ScorerExceptionBuilder.create(ScorerError.INVALID_FORMAT, "Not a binary language model")
                    .path(path)
                    .build();
        }
        int version = buffer.getInt();
        if (version != NgramModelFormat.FORMAT_VERSION) {
            throw ScorerExceptionBuilder.create(ScorerError.INVALID_FORMAT, "Unsupported language model format version")
                    .path(path)
                    .metadata("found", version)
                    .metadata("expected", NgramModelFormat.FORMAT_VERSION)
                    .build();
        }
        int order = buffer.getInt();
        int vocabularySize = buffer.getInt();
        if (order < 1 || vocabularySize < 1
                || order > buffer.remaining() / Long.BYTES
                || vocabularySize > (buffer.remaining() - (long) order * Long.BYTES) / Integer.BYTES) {
            throw ScorerExceptionBuilder.create(ScorerError.INVALID_FORMAT, "Invalid language model header")
                    .path(path)
                    .metadata("order", order)
                    .metadata("vocabulary", vocabularySize)
                    .build();
        }
        long[] counts = new long[order];
        for (int n = 0; n < order; n++) {
            counts[n] = buffer.getLong();
            if (counts[n] < 0 || counts[n] > buffer.limit() / NgramModelFormat.recordBytes(n + 1)) {
                throw malformed(path, "Language model n-gram count out of range")
                        .metadata("order", n + 1)
                        .metadata("count", counts[n])
                        .build();
            }
        }

        List<String> vocabulary = new ArrayList<>(vocabularySize);
        for (int i = 0; i < vocabularySize; i++) {
            int wordLength = buffer.getInt();
            if (wordLength < 0 || wordLength > buffer.remaining()) {
                throw malformed(path, "Language model word length out of range")
                        .metadata("word", i)
                        .metadata("length", wordLength)
                        .build();
            }
            byte[] word = new byte[wordLength];
            buffer.get(word);
            vocabulary.add(new String(word, StandardCharsets.UTF_8));
        }
        if (!LanguageModelTokens.UNK.equals(vocabulary.get(UNKNOWN_WORD))) {
            throw ScorerExceptionBuilder.create(ScorerError.INVALID_FORMAT, "Language model vocabulary must start with "
                            + LanguageModelTokens.UNK)
                    .path(path)
                    .build();
        }
        int position = buffer.position() + NgramModelFormat.padding(buffer.position());

        NgramTable[] tables = new NgramTable[order];
        for (int n = 1; n <= order; n++) {
            long tableBytes = counts[n - 1] * NgramModelFormat.recordBytes(n);
            if (tableBytes > buffer.limit() - (long) position) {
                throw malformed(path, "Language model n-gram table extends past the end of the file")
                        .metadata("order", n)
                        .metadata("count", counts[n - 1])
                        .build();
            }
            int length = (int) tableBytes;
            ByteBuffer records = buffer.slice(position, length).order(ByteOrder.LITTLE_ENDIAN);
            if (method == LoadMethod.READ) {
                ByteBuffer heap = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
                heap.put(records);
                heap.flip();
                records = heap;
            }
            tables[n - 1] = new NgramTable(records, n, (int) counts[n - 1]);
            position += length;
        }

        BackoffLanguageModel model = new BackoffLanguageModel(order, position, vocabulary, tables);
        if (model.beginSentence == UNKNOWN_WORD || model.endSentence == UNKNOWN_WORD) {
            throw ScorerExceptionBuilder.create(ScorerError.INVALID_FORMAT, "Language model lacks sentence markers "
                            + LanguageModelTokens.START + " and " + LanguageModelTokens.END)
                    .path(path)
                    .build();
        }
        LOG.debug("Loaded {} language model '{}': order={}, unigrams={}, endOffset={}",
                method, path, order, counts[0], position);
        return model;
    }

    private static ScorerExceptionBuilder malformed(Path path, String message) {
        return ScorerExceptionBuilder.create(ScorerError.INVALID_FORMAT, message).path(path);
    }

    @Override
    public int order() {
        return order;
    }

    @Override
    public long endOfModelOffset() {
        return endOffset;
    }

    @Override
    public int index(String word) {
        return wordIds.getOrDefault(word, UNKNOWN_WORD);
    }

    @Override
    public int endSentence() {
        return endSentence;
    }

    @Override
    public LmState beginSentenceState() {
        return LmState.of(beginSentence);
    }

    @Override
    public LmState nullContextState() {
        return LmState.empty();
    }

    @Override
    public LmTransition score(LmState state, int word) {
        int contextLength = state.length();
        int[] ngram = Arrays.copyOf(state.words(), contextLength + 1);
        ngram[contextLength] = word;

        float backoff = 0.0f;
        for (int start = 0; start <= contextLength; start++) {
            int n = contextLength + 1 - start;
            if (n <= order) {
                NgramTable table = tables[n - 1];
                int found = table.find(ngram, start, contextLength + 1);
                if (found >= 0) {
                    return new LmTransition(table.log10Prob(found) + backoff,
                            nextState(ngram, start, contextLength + 1));
                }
            }
            // Drop the oldest context word, paying its context's backoff weight
            int contextN = n - 1;
            if (contextN >= 1 && contextN <= order) {
                NgramTable contextTable = tables[contextN - 1];
                int found = contextTable.find(ngram, start, contextLength);
                if (found >= 0) {
                    backoff += contextTable.backoff(found);
                }
            }
        }
        // Word id outside the unigram table: score as <unk>
        int unk = tables[0].find(new int[]{UNKNOWN_WORD}, 0, 1);
        float unkProb = unk >= 0 ? tables[0].log10Prob(unk) : ArpaReader.DEFAULT_UNK_LOG10_PROB;
        return new LmTransition(unkProb + backoff, LmState.empty());
    }

    /**
     * Longest suffix of the matched n-gram, at most {@code order - 1} words, that is itself stored.
     */
    private LmState nextState(int[] ngram, int from, int to) {
        int start = Math.max(from, to - (order - 1));
        while (start < to) {
            int n = to - start;
            if (tables[n - 1].find(ngram, start, to) >= 0) {
                return LmState.of(Arrays.copyOfRange(ngram, start, to));
            }
            start++;
        }
        return LmState.empty();
    }

    @Override
    public List<String> vocabulary() {
        return vocabulary;
    }
}
