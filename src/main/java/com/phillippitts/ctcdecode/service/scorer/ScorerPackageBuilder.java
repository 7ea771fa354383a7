package com.phillippitts.ctcdecode.service.scorer;

import com.phillippitts.ctcdecode.exception.ScorerError;
import com.phillippitts.ctcdecode.exception.ScorerExceptionBuilder;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.lm.ArpaModel;
import com.phillippitts.ctcdecode.service.lm.ArpaReader;
import com.phillippitts.ctcdecode.service.lm.BackoffLanguageModel;
import com.phillippitts.ctcdecode.service.lm.LoadMethod;
import com.phillippitts.ctcdecode.service.lm.NgramModelWriter;
import com.phillippitts.ctcdecode.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Produces a scorer package from an ARPA language model.
 *
 * <p>The binary model is written first, then the dictionary package is appended to it:
 * <pre>
 * ScorerPackageBuilder.forAlphabet(alphabet)
 *         .alpha(0.93)
 *         .beta(1.18)
 *         .build(Path.of("lm.arpa"), Path.of("kenlm.scorer"));
 * </pre>
 * Without an explicit vocabulary the language model's own words form the dictionary.
 */
public final class ScorerPackageBuilder {

    private static final Logger LOG = LogManager.getLogger(ScorerPackageBuilder.class);

    private final Alphabet alphabet;
    private double alpha;
    private double beta;
    private Collection<String> vocabulary;
    private int determinizeWorkLimit = Scorer.DEFAULT_DETERMINIZE_WORK_LIMIT;

    private ScorerPackageBuilder(Alphabet alphabet) {
        this.alphabet = alphabet;
    }

    public static ScorerPackageBuilder forAlphabet(Alphabet alphabet) {
        return new ScorerPackageBuilder(Objects.requireNonNull(alphabet, "alphabet"));
    }

    public ScorerPackageBuilder alpha(double alpha) {
        this.alpha = alpha;
        return this;
    }

    public ScorerPackageBuilder beta(double beta) {
        this.beta = beta;
        return this;
    }

    /**
     * Restricts the dictionary to these words instead of the model vocabulary.
     */
    public ScorerPackageBuilder vocabulary(Collection<String> vocabulary) {
        this.vocabulary = List.copyOf(vocabulary);
        return this;
    }

    public ScorerPackageBuilder determinizeWorkLimit(int determinizeWorkLimit) {
        this.determinizeWorkLimit = determinizeWorkLimit;
        return this;
    }

    /**
     * Writes the package.
     *
     * @param arpaPath ARPA text model
     * @param output   package file, replaced if present
     * @return scorer holding the freshly built dictionary and language model
     * @throws com.phillippitts.ctcdecode.exception.ScorerException with
     *         {@link ScorerError#PERSIST_FAILURE} if the output cannot be written
     */
    public Scorer build(Path arpaPath, Path output) {
        long startTime = System.nanoTime();
        ArpaModel arpa = ArpaReader.read(arpaPath);
        BackoffLanguageModel model;
        try {
            NgramModelWriter.write(arpa, output);
            model = BackoffLanguageModel.load(output, LoadMethod.READ);
        } catch (IOException e) {
            throw ScorerExceptionBuilder.create(ScorerError.PERSIST_FAILURE, "Failed to write binary language model")
                    .path(output)
                    .cause(e)
                    .build();
        }

        Scorer packaged = new Scorer(alphabet, model, alphabet.isUtf8(), determinizeWorkLimit);
        packaged.resetParams(alpha, beta);
        packaged.fillDictionary(vocabulary != null ? vocabulary : model.vocabulary());
        packaged.saveDictionary(output, true);

        LOG.info("Built scorer package '{}' from '{}' in {}ms (order={}, words={})",
                output, arpaPath, TimeUtils.elapsedMillis(startTime), model.order(),
                vocabulary != null ? vocabulary.size() : model.vocabulary().size());
        return packaged;
    }
}
