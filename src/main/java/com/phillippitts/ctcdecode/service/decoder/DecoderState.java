package com.phillippitts.ctcdecode.service.decoder;

import com.phillippitts.ctcdecode.config.decoder.DecoderProperties;
import com.phillippitts.ctcdecode.domain.CandidateTranscript;
import com.phillippitts.ctcdecode.domain.TokenMetadata;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.scorer.Scorer;
import com.phillippitts.ctcdecode.service.trie.PathTrie;
import com.phillippitts.ctcdecode.util.LogMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CTC prefix beam search over a stream of acoustic frames.
 *
 * <p>Hypotheses live in a {@link PathTrie}; each frame extends the current beam with the
 * most probable labels, merges paths that collapse to the same prefix and keeps the best
 * {@code beamWidth} prefixes. With a {@link Scorer}, every completed word (or codepoint in
 * UTF-8 mode) adds {@code alpha * lm + beta}, and the scorer's dictionary restricts
 * prefixes to vocabulary spellings. In UTF-8 mode prefixes only ever hold well-formed byte
 * sequences.
 *
 * <p>Not thread-safe: one instance per stream. The scorer may be shared.
 */
public class DecoderState {

    private static final Logger LOG = LogManager.getLogger(DecoderState.class);

    /** Blank probability below which the first frames start expanding beams. */
    private static final double START_EXPANDING_BLANK_PROB = 0.999;

    private static final Comparator<PathTrie> BY_SCORE = (x, y) -> {
        int cmp = Float.compare(y.score(), x.score());
        return cmp != 0 ? cmp : Integer.compare(x.character(), y.character());
    };

    private final Alphabet alphabet;
    private final Scorer scorer;
    private final int beamWidth;
    private final double cutoffProb;
    private final int cutoffTopN;
    private final int blankLabel;
    private final boolean utf8Bytes;
    private final PathTrie root;

    private List<PathTrie> prefixes = new ArrayList<>();
    private int absoluteTimestep;
    private boolean startExpanding;

    /**
     * @param alphabet   alphabet of the acoustic model
     * @param properties beam settings
     * @param scorer     external scorer, or null for acoustic-only decoding
     */
    public DecoderState(Alphabet alphabet, DecoderProperties properties, Scorer scorer) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        Objects.requireNonNull(properties, "properties");
        this.scorer = scorer;
        this.beamWidth = properties.getBeamWidth();
        this.cutoffProb = properties.getCutoffProb();
        this.cutoffTopN = properties.getCutoffTopN();
        this.blankLabel = alphabet.blankLabel();

        this.utf8Bytes = scorer != null && scorer.isUtf8Mode();
        this.root = scorer != null && scorer.dictionary() != null
                ? PathTrie.root(scorer.dictionary())
                : PathTrie.root();
        prefixes.add(root);
    }

    /**
     * Consumes acoustic output for {@code timeDim} frames.
     *
     * @param probs    row-major {@code [timeDim][classDim]} label probabilities
     * @param timeDim  number of frames
     * @param classDim labels per frame: alphabet size plus the blank
     */
    public void next(float[] probs, int timeDim, int classDim) {
        if (classDim != alphabet.size() + 1) {
            throw new IllegalArgumentException("Expected " + (alphabet.size() + 1)
                    + " classes per frame, got " + classDim);
        }
        if (probs.length < (long) timeDim * classDim) {
            throw new IllegalArgumentException("Probability buffer holds " + probs.length
                    + " values, need " + (long) timeDim * classDim);
        }

        for (int t = 0; t < timeDim; t++, absoluteTimestep++) {
            int base = t * classDim;
            if (probs[base + blankLabel] < START_EXPANDING_BLANK_PROB) {
                startExpanding = true;
            }
            if (!startExpanding) {
                continue;
            }

            float minCutoff = Float.NEGATIVE_INFINITY;
            boolean fullBeam = false;
            if (scorer != null) {
                int numPrefixes = Math.min(prefixes.size(), beamWidth);
                prefixes.sort(BY_SCORE);
                minCutoff = (float) (prefixes.get(numPrefixes - 1).score()
                        + Math.log(probs[base + blankLabel]) - Math.max(0.0, scorer.beta()));
                fullBeam = numPrefixes == beamWidth;
            }

            Set<PathTrie> touched = new LinkedHashSet<>(prefixes);
            for (PrunedLabel candidate : prunedLogProbs(probs, base, classDim)) {
                int c = candidate.label();
                float logProbC = candidate.logProb();
                for (int i = 0; i < prefixes.size() && i < beamWidth; i++) {
                    PathTrie prefix = prefixes.get(i);
                    if (fullBeam && logProbC + prefix.score() < minCutoff) {
                        break;
                    }
                    if (prefix.score() == Float.NEGATIVE_INFINITY) {
                        continue;
                    }

                    if (c == blankLabel) {
                        prefix.setLogProbBCur(LogMath.logSumExp(prefix.logProbBCur(), logProbC + prefix.score()));
                        continue;
                    }

                    if (c == prefix.character()) {
                        prefix.setLogProbNbCur(LogMath.logSumExp(prefix.logProbNbCur(),
                                logProbC + prefix.logProbNbPrev()));
                    }

                    if (utf8Bytes && !prefix.acceptsUtf8Byte(c, alphabet)) {
                        continue;
                    }
                    PathTrie prefixNew = prefix.extend(c, absoluteTimestep, logProbC);
                    if (prefixNew == null) {
                        continue;
                    }
                    touched.add(prefixNew);

                    float logP = Float.NEGATIVE_INFINITY;
                    if (c == prefix.character() && prefix.logProbBPrev() > Float.NEGATIVE_INFINITY) {
                        logP = logProbC + prefix.logProbBPrev();
                    } else if (c != prefix.character()) {
                        logP = logProbC + prefix.score();
                    }

                    if (scorer != null) {
                        // The space itself is not scored in word mode
                        PathTrie toScore = scorer.isUtf8Mode() ? prefixNew : prefix;
                        if (scorer.isScoringBoundary(toScore, c)) {
                            logP += (float) languageModelScore(toScore);
                        }
                    }
                    prefixNew.setLogProbNbCur(LogMath.logSumExp(prefixNew.logProbNbCur(), logP));
                }
            }

            List<PathTrie> next = new ArrayList<>(touched.size());
            for (PathTrie node : touched) {
                if (node.isActive()) {
                    node.updateScores();
                    next.add(node);
                }
            }
            if (next.size() > beamWidth) {
                next.sort(BY_SCORE);
                for (PathTrie dropped : next.subList(beamWidth, next.size())) {
                    dropped.remove();
                }
                next = new ArrayList<>(next.subList(0, beamWidth));
            }
            prefixes = next;
        }
    }

    private double languageModelScore(PathTrie prefix) {
        List<String> ngram = scorer.makeNgram(prefix);
        boolean bos = ngram.size() < scorer.maxOrder();
        return scorer.getLogCondProb(ngram, bos, false) * scorer.alpha() + scorer.beta();
    }

    /**
     * Labels worth expanding at one frame: the most probable ones until their cumulative
     * probability reaches {@code cutoffProb}, at most {@code cutoffTopN} of them.
     */
    List<PrunedLabel> prunedLogProbs(float[] probs, int base, int classDim) {
        Integer[] order = new Integer[classDim];
        for (int i = 0; i < classDim; i++) {
            order[i] = i;
        }
        int cutoffLen = classDim;
        if (cutoffProb < 1.0 || cutoffTopN < classDim) {
            Arrays.sort(order, (a, b) -> Float.compare(probs[base + b], probs[base + a]));
            if (cutoffProb < 1.0) {
                double cumulative = 0.0;
                cutoffLen = 0;
                for (int i = 0; i < classDim; i++) {
                    cumulative += probs[base + order[i]];
                    cutoffLen++;
                    if (cumulative >= cutoffProb || cutoffLen >= cutoffTopN) {
                        break;
                    }
                }
            } else {
                cutoffLen = Math.min(cutoffTopN, classDim);
            }
        }
        List<PrunedLabel> out = new ArrayList<>(cutoffLen);
        for (int i = 0; i < cutoffLen; i++) {
            int label = order[i];
            out.add(new PrunedLabel(label, (float) Math.log(probs[base + label] + Float.MIN_NORMAL)));
        }
        return out;
    }

    /**
     * Ranks the current beam. Prefixes that end inside a word get that word scored first,
     * then the language-model contribution is removed from the reported confidence.
     * Does not change the decoder state, so it can be called between {@link #next} calls.
     *
     * @param numResults maximum number of transcripts
     * @return best transcripts first
     */
    public List<CandidateTranscript> decode(int numResults) {
        Map<PathTrie, Double> scores = new IdentityHashMap<>();
        for (PathTrie prefix : prefixes) {
            scores.put(prefix, (double) prefix.score());
        }

        if (scorer != null) {
            for (int i = 0; i < prefixes.size() && i < beamWidth; i++) {
                PathTrie prefix = prefixes.get(i);
                if (prefix.isRoot()) {
                    continue;
                }
                PathTrie boundary = scorer.isUtf8Mode() ? prefix : prefix.parent();
                if (!scorer.isScoringBoundary(boundary, prefix.character())) {
                    scores.merge(prefix, languageModelScore(prefix), Double::sum);
                }
            }
        }

        List<PathTrie> ranked = new ArrayList<>(prefixes);
        ranked.sort((x, y) -> {
            int cmp = Double.compare(scores.get(y), scores.get(x));
            return cmp != 0 ? cmp : Integer.compare(x.character(), y.character());
        });

        int returned = Math.min(ranked.size(), numResults);
        List<CandidateTranscript> results = new ArrayList<>(returned);
        for (int i = 0; i < returned; i++) {
            PathTrie prefix = ranked.get(i);
            List<Integer> labels = new ArrayList<>();
            List<Integer> timesteps = new ArrayList<>();
            prefix.getPathVec(labels, timesteps);

            double confidence = scores.get(prefix);
            if (scorer != null) {
                List<String> units = scorer.splitLabelsIntoScoredUnits(labels);
                confidence -= units.size() * scorer.beta();
                confidence -= scorer.getSentLogProb(units) * scorer.alpha();
            }

            List<TokenMetadata> tokens = new ArrayList<>(labels.size());
            for (int j = 0; j < labels.size(); j++) {
                tokens.add(new TokenMetadata(alphabet.stringFromLabel(labels.get(j)), timesteps.get(j)));
            }
            results.add(new CandidateTranscript(alphabet.labelsToString(labels), tokens, confidence));
        }
        LOG.debug("Decoded {} of {} prefixes after {} frames", returned, prefixes.size(), absoluteTimestep);
        return results;
    }

    /** Frames consumed so far. */
    public int timestep() {
        return absoluteTimestep;
    }

    int beamSize() {
        return prefixes.size();
    }

    record PrunedLabel(int label, float logProb) {
    }
}
