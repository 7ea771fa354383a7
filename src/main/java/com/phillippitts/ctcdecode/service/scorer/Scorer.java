package com.phillippitts.ctcdecode.service.scorer;

import com.phillippitts.ctcdecode.exception.ScorerError;
import com.phillippitts.ctcdecode.exception.ScorerException;
import com.phillippitts.ctcdecode.exception.ScorerExceptionBuilder;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.alphabet.CharacterMap;
import com.phillippitts.ctcdecode.service.alphabet.Utf8Alphabet;
import com.phillippitts.ctcdecode.service.dictionary.DictionaryBuilder;
import com.phillippitts.ctcdecode.service.dictionary.FrozenDictionary;
import com.phillippitts.ctcdecode.service.dictionary.VocabularyAutomaton;
import com.phillippitts.ctcdecode.service.lm.BackoffLanguageModel;
import com.phillippitts.ctcdecode.service.lm.LanguageModel;
import com.phillippitts.ctcdecode.service.lm.LmState;
import com.phillippitts.ctcdecode.service.lm.LmTransition;
import com.phillippitts.ctcdecode.service.lm.LoadMethod;
import com.phillippitts.ctcdecode.service.lm.NgramModelFormat;
import com.phillippitts.ctcdecode.service.trie.PathTrie;
import com.phillippitts.ctcdecode.util.TimeUtils;
import com.phillippitts.ctcdecode.util.Utf8Utils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * External scorer for CTC beam search: an n-gram language model paired with a vocabulary
 * dictionary and the fusion weights used to blend them with acoustic scores.
 *
 * <p>A scorer package is a single file: the binary language model, followed by a
 * {@link ScorerPackageHeader} and a serialized {@link FrozenDictionary}.
 *
 * <p>Loading and {@link #fillDictionary(Collection)} are single-threaded. Once loaded, all
 * query methods may be called from any number of decoding streams; {@link #resetParams(double, double)}
 * must not race with decoding.
 */
public class Scorer {

    private static final Logger LOG = LogManager.getLogger(Scorer.class);

    /** Package header magic, ASCII 'TRIE'. */
    public static final int MAGIC = 0x54524945;
    public static final int FILE_VERSION = 6;

    /** Natural-log score of a sequence containing a word unknown to the language model. */
    public static final double OOV_SCORE = -1000.0;

    /** log10(e): divides a base-10 log probability into a natural-log one. */
    public static final double NUM_FLT_LOGE = 0.4342944819;

    public static final int DEFAULT_DETERMINIZE_WORK_LIMIT = 10_000_000;

    private final LoadMethod loadMethod;
    private final int determinizeWorkLimit;

    private Alphabet alphabet;
    private CharacterMap characterMap;
    private LanguageModel languageModel;
    private VocabularyAutomaton dictionary;
    private boolean utf8Mode;
    private int maxOrder;
    private volatile ScorerParameters parameters = new ScorerParameters(0.0, 0.0);

    public Scorer() {
        this(LoadMethod.LAZY, DEFAULT_DETERMINIZE_WORK_LIMIT);
    }

    /**
     * @param loadMethod           how the language model is brought into memory
     * @param determinizeWorkLimit effort limit for dictionary determinization
     */
    public Scorer(LoadMethod loadMethod, int determinizeWorkLimit) {
        this.loadMethod = Objects.requireNonNull(loadMethod, "loadMethod");
        if (determinizeWorkLimit <= 0) {
            throw new IllegalArgumentException("determinizeWorkLimit must be positive: " + determinizeWorkLimit);
        }
        this.determinizeWorkLimit = determinizeWorkLimit;
    }

    /**
     * Creates a scorer over an already loaded language model. The dictionary is built later
     * with {@link #fillDictionary(Collection)}.
     */
    public Scorer(Alphabet alphabet, LanguageModel languageModel, boolean utf8Mode) {
        this(alphabet, languageModel, utf8Mode, DEFAULT_DETERMINIZE_WORK_LIMIT);
    }

    public Scorer(Alphabet alphabet, LanguageModel languageModel, boolean utf8Mode, int determinizeWorkLimit) {
        this(LoadMethod.LAZY, determinizeWorkLimit);
        setAlphabet(alphabet);
        this.languageModel = Objects.requireNonNull(languageModel, "languageModel");
        this.maxOrder = languageModel.order();
        this.utf8Mode = utf8Mode;
    }

    /**
     * Sets the alphabet and loads a scorer package.
     *
     * @param modelPath scorer package file
     * @param alphabet  acoustic model alphabet
     * @throws ScorerException if the package cannot be loaded
     */
    public void init(Path modelPath, Alphabet alphabet) {
        setAlphabet(alphabet);
        loadLm(modelPath);
    }

    /**
     * Loads the alphabet from its config file, then the scorer package.
     */
    public void init(Path modelPath, Path alphabetConfigPath) {
        init(modelPath, Alphabet.fromConfig(alphabetConfigPath));
    }

    public void setAlphabet(Alphabet alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        this.characterMap = new CharacterMap(alphabet);
    }

    /**
     * Loads the language model and the dictionary package that follows it.
     *
     * @param path scorer package file
     * @throws ScorerException with {@link ScorerError#FILE_UNREADABLE}, {@link ScorerError#INVALID_FORMAT},
     *         {@link ScorerError#MISSING_PACKAGE} or any error raised by {@link #loadTrie(FileChannel, Path)}
     */
    public void loadLm(Path path) {
        Objects.requireNonNull(path, "path");
        if (alphabet == null) {
            throw new IllegalStateException("Alphabet must be set before loading a scorer");
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw ScorerExceptionBuilder.create(ScorerError.FILE_UNREADABLE, "Scorer file is not readable")
                    .path(path)
                    .build();
        }
        long startTime = System.nanoTime();
        try {
            if (!NgramModelFormat.recognizeBinary(path)) {
                throw ScorerExceptionBuilder.create(ScorerError.INVALID_FORMAT,
                                "Scorer file does not start with a binary language model")
                        .path(path)
                        .build();
            }
            LanguageModel model = BackoffLanguageModel.load(path, loadMethod);
            this.languageModel = model;
            this.maxOrder = model.order();

            try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
                long fileSize = channel.size();
                long modelEnd = model.endOfModelOffset();
                if (fileSize <= modelEnd) {
                    throw ScorerExceptionBuilder.create(ScorerError.MISSING_PACKAGE,
                                    "Scorer file ends without a dictionary package")
                            .path(path)
                            .metadata("fileSize", fileSize)
                            .metadata("modelEnd", modelEnd)
                            .build();
                }
                channel.position(modelEnd);
                loadTrie(channel, path);
            }
        } catch (IOException e) {
            throw ScorerExceptionBuilder.create(ScorerError.FILE_UNREADABLE, "Failed to read scorer file")
                    .path(path)
                    .cause(e)
                    .build();
        }
        LOG.info("Loaded scorer '{}' in {}ms (order={}, utf8Mode={}, alpha={}, beta={}, loadMethod={})",
                path, TimeUtils.elapsedMillis(startTime), maxOrder, utf8Mode, alpha(), beta(), loadMethod);
    }

    /**
     * Reads the package header and dictionary starting at the channel's position.
     *
     * @param channel open package file, positioned at the end of the language model
     * @param path    file name for diagnostics
     * @throws IOException if the channel cannot be read
     * @throws ScorerException with {@link ScorerError#CORRUPT_PACKAGE_HEADER} or
     *         {@link ScorerError#VERSION_MISMATCH}
     */
    public void loadTrie(FileChannel channel, Path path) throws IOException {
        long offset = channel.position();
        long available = channel.size() - offset;
        if (available < ScorerPackageHeader.MAGIC_BYTES || available > Integer.MAX_VALUE) {
            throw corruptHeader(path, "Scorer package has an invalid size").metadata("bytes", available).build();
        }
        ByteBuffer region = channel.map(FileChannel.MapMode.READ_ONLY, offset, available)
                .order(ByteOrder.LITTLE_ENDIAN);

        int magic = region.getInt();
        if (magic != MAGIC) {
            throw corruptHeader(path, "Scorer package header has the wrong magic number")
                    .metadata("found", "0x" + Integer.toHexString(magic))
                    .metadata("offset", offset)
                    .hint("Try updating your scorer file.")
                    .build();
        }
        if (region.remaining() < Integer.BYTES) {
            throw corruptHeader(path, "Scorer package header is truncated").build();
        }
        int version = region.getInt();
        if (version != FILE_VERSION) {
            String hint = version < FILE_VERSION
                    ? "Update your scorer file."
                    : "Downgrade your scorer file or update your version of the decoder.";
            throw ScorerExceptionBuilder.create(ScorerError.VERSION_MISMATCH, "Scorer package version mismatch")
                    .path(path)
                    .metadata("found", version)
                    .metadata("expected", FILE_VERSION)
                    .hint(hint)
                    .build();
        }
        if (region.remaining() < ScorerPackageHeader.BYTES - ScorerPackageHeader.PREFIX_BYTES) {
            throw corruptHeader(path, "Scorer package header is truncated").build();
        }
        ScorerPackageHeader header = ScorerPackageHeader.readParameters(magic, version, region);

        if (header.utf8Mode() && !alphabet.isUtf8()) {
            LOG.warn("Scorer '{}' was built in UTF-8 mode; switching to the byte alphabet", path);
            setAlphabet(new Utf8Alphabet());
        }
        this.utf8Mode = header.utf8Mode();
        resetParams(header.alpha(), header.beta());

        try {
            this.dictionary = FrozenDictionary.read(region);
        } catch (IllegalArgumentException e) {
            throw corruptHeader(path, "Scorer package dictionary is malformed").cause(e).build();
        }
        LOG.debug("Loaded dictionary from '{}' at offset {}: {}", path, offset, dictionary);
    }

    private static ScorerExceptionBuilder corruptHeader(Path path, String message) {
        return ScorerExceptionBuilder.create(ScorerError.CORRUPT_PACKAGE_HEADER, message).path(path);
    }

    /**
     * Writes the package header and dictionary.
     *
     * @param path   target file
     * @param append true to append after existing content (a binary language model),
     *               false to replace the file
     * @throws ScorerException with {@link ScorerError#PERSIST_FAILURE} on I/O failure
     */
    public void saveDictionary(Path path, boolean append) {
        if (dictionary == null) {
            throw new IllegalStateException("No dictionary to save; call fillDictionary or load a package first");
        }
        ScorerParameters params = parameters;
        ByteBuffer header = new ScorerPackageHeader(MAGIC, FILE_VERSION, utf8Mode, params.alpha(), params.beta())
                .encode();
        ByteBuffer blob = dictionary.serialize();
        StandardOpenOption mode = append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode)) {
            while (header.hasRemaining()) {
                channel.write(header);
            }
            while (blob.hasRemaining()) {
                channel.write(blob);
            }
        } catch (IOException e) {
            throw ScorerExceptionBuilder.create(ScorerError.PERSIST_FAILURE, "Failed to write scorer package")
                    .path(path)
                    .metadata("append", append)
                    .cause(e)
                    .build();
        }
        LOG.info("Saved scorer package to '{}' (append={}, dictionaryStates={})",
                path, append, dictionary.numStates());
    }

    /**
     * Whether extending {@code prefix} with {@code newLabel} completes a unit the language
     * model should score: a word in word mode, a codepoint in UTF-8 mode.
     *
     * @throws ScorerException with {@link ScorerError#INTERNAL_INCONSISTENCY} if the prefix
     *         holds an invalid UTF-8 lead byte
     */
    public boolean isScoringBoundary(PathTrie prefix, int newLabel) {
        if (utf8Mode) {
            if (prefix == null || prefix.isRoot()) {
                return false;
            }
            PathTrie.CodepointBoundary boundary = prefix.distanceToCodepointBoundary(alphabet);
            int needed = Utf8Utils.sequenceLength(boundary.leadByte());
            if (needed < 0) {
                throw ScorerExceptionBuilder.create(ScorerError.INTERNAL_INCONSISTENCY,
                                "Prefix holds an invalid UTF-8 lead byte")
                        .metadata("leadByte", "0x" + Integer.toHexString(boundary.leadByte()))
                        .build();
            }
            return boundary.distance() == needed;
        }
        return newLabel == alphabet.spaceLabel();
    }

    /**
     * Natural-log probability of the last unit of {@code units} given the ones before it.
     *
     * @param units words (or codepoints in UTF-8 mode)
     * @param bos   condition on the begin-of-sentence context
     * @param eos   score the end-of-sentence token after the last unit instead
     * @return log probability, or {@link #OOV_SCORE} if any unit is unknown to the model
     */
    public double getLogCondProb(List<String> units, boolean bos, boolean eos) {
        return getLogCondProb(units, 0, units.size(), bos, eos);
    }

    /**
     * Same as {@link #getLogCondProb(List, boolean, boolean)} over {@code units[from..to)}.
     */
    public double getLogCondProb(List<String> units, int from, int to, boolean bos, boolean eos) {
        LanguageModel model = requireLanguageModel();
        LmState state = bos ? model.beginSentenceState() : model.nullContextState();
        double condProb = 0.0;
        for (int i = from; i < to; i++) {
            int word = model.index(units.get(i));
            if (word == LanguageModel.UNKNOWN_WORD) {
                return OOV_SCORE;
            }
            LmTransition transition = model.score(state, word);
            condProb = transition.log10Prob();
            state = transition.next();
        }
        if (eos) {
            condProb = model.score(state, model.endSentence()).log10Prob();
        }
        return condProb / NUM_FLT_LOGE;
    }

    /**
     * Total language-model contribution of a sentence, summed over windows of at most
     * {@code maxOrder} units. Windows shorter than the order condition on the begin-of-sentence
     * context; the last window scores the end-of-sentence token.
     *
     * @param words complete hypothesis
     * @return natural-log score, 0 for an empty sentence
     */
    public double getSentLogProb(List<String> words) {
        int length = words.size();
        if (length == 0) {
            return 0.0;
        }
        double score = 0.0;
        int windowStart = 0;
        for (int windowEnd = 1; windowEnd <= length + 1; windowEnd++) {
            int windowSize = windowEnd - windowStart;
            boolean bos = windowSize < maxOrder;
            boolean eos = windowEnd == length + 1;
            score += getLogCondProb(words, windowStart, eos ? windowEnd - 1 : windowEnd, bos, eos);
            if (windowSize == maxOrder) {
                windowStart++;
            }
        }
        return score;
    }

    /**
     * Decodes labels into scoring units: codepoints in UTF-8 mode, space-separated words otherwise.
     */
    public List<String> splitLabelsIntoScoredUnits(List<Integer> labels) {
        if (labels.isEmpty()) {
            return List.of();
        }
        String text = alphabet.labelsToString(labels);
        if (utf8Mode) {
            return Utf8Utils.splitIntoCodepoints(text);
        }
        List<String> words = new ArrayList<>();
        for (String word : text.split(" ")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * Rebuilds the last {@code maxOrder} scoring units ending at {@code prefix}, oldest first.
     */
    public List<String> makeNgram(PathTrie prefix) {
        List<String> ngram = new ArrayList<>(maxOrder);
        int spaceLabel = alphabet.spaceLabel();
        PathTrie current = prefix;
        for (int order = 0; order < maxOrder; order++) {
            if (!utf8Mode) {
                while (current != null && !current.isRoot() && current.character() == spaceLabel) {
                    current = current.parent();
                }
            }
            if (current == null || current.isRoot()) {
                break;
            }
            List<Integer> labels = new ArrayList<>();
            List<Integer> timesteps = new ArrayList<>();
            PathTrie first = utf8Mode
                    ? current.getPrevGrapheme(labels, timesteps, alphabet)
                    : current.getPrevWord(labels, timesteps, spaceLabel);
            current = first.parent();
            ngram.add(alphabet.labelsToString(labels));
        }
        Collections.reverse(ngram);
        return ngram;
    }

    /**
     * Builds the dictionary from a vocabulary. Reserved LM tokens and words the alphabet
     * cannot spell are left out. In UTF-8 mode the vocabulary units are codepoints and the
     * dictionary accepts any sequence of them.
     */
    public void fillDictionary(Collection<String> vocabulary) {
        if (alphabet == null) {
            throw new IllegalStateException("Alphabet must be set before building a dictionary");
        }
        DictionaryBuilder builder = utf8Mode
                ? DictionaryBuilder.forCodepoints(characterMap, determinizeWorkLimit)
                : new DictionaryBuilder(characterMap, determinizeWorkLimit, alphabet.spaceLabel());
        for (String word : vocabulary) {
            builder.addWord(word);
        }
        this.dictionary = builder.build();
    }

    /**
     * Replaces the fusion weights. Not safe against concurrent decoding.
     */
    public void resetParams(double alpha, double beta) {
        this.parameters = new ScorerParameters(alpha, beta);
    }

    public double alpha() {
        return parameters.alpha();
    }

    public double beta() {
        return parameters.beta();
    }

    public ScorerParameters parameters() {
        return parameters;
    }

    public int maxOrder() {
        return maxOrder;
    }

    public boolean isUtf8Mode() {
        return utf8Mode;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /** Loaded or built dictionary, or null before either happened. */
    public VocabularyAutomaton dictionary() {
        return dictionary;
    }

    public LanguageModel languageModel() {
        return languageModel;
    }

    private LanguageModel requireLanguageModel() {
        if (languageModel == null) {
            throw new IllegalStateException("No language model loaded");
        }
        return languageModel;
    }
}
