package com.phillippitts.ctcdecode.service.dictionary;

import com.phillippitts.ctcdecode.exception.CtcDecodeException;
import com.phillippitts.ctcdecode.service.alphabet.CharacterMap;
import com.phillippitts.ctcdecode.service.lm.LanguageModelTokens;
import com.phillippitts.ctcdecode.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.MinimizationOperations;
import org.apache.lucene.util.automaton.Operations;
import org.apache.lucene.util.automaton.TooComplexToDeterminizeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles a vocabulary into a {@link FrozenDictionary}.
 *
 * <p>Every word becomes a chain of states reached from the start state through an epsilon
 * transition. The last state of a chain accepts and carries a space-symbol transition back
 * to the start state, so matching restarts after a word boundary. The union is then
 * epsilon-free, determinized and minimized.
 *
 * <p>{@link #forCodepoints} builds the UTF-8 variant instead: words are byte chains with no
 * space edges, and the union is repeated so any sequence of vocabulary units is accepted.
 *
 * <p>Not thread-safe; use one builder per dictionary.
 */
public final class DictionaryBuilder {

    private static final Logger LOG = LogManager.getLogger(DictionaryBuilder.class);

    private final CharacterMap characterMap;
    private final int workLimit;
    private final int spaceSymbol;
    private final boolean repeated;
    private final List<int[]> words = new ArrayList<>();
    private int skipped;

    /**
     * @param characterMap maps word units to symbols
     * @param workLimit    determinization effort limit (Lucene work units)
     * @param spaceLabel   alphabet space label, or a negative value when the alphabet has none
     */
    public DictionaryBuilder(CharacterMap characterMap, int workLimit, int spaceLabel) {
        this(characterMap, workLimit, spaceLabel, false);
    }

    private DictionaryBuilder(CharacterMap characterMap, int workLimit, int spaceLabel, boolean repeated) {
        this.characterMap = Objects.requireNonNull(characterMap, "characterMap");
        if (workLimit <= 0) {
            throw new IllegalArgumentException("workLimit must be positive: " + workLimit);
        }
        this.workLimit = workLimit;
        this.spaceSymbol = spaceLabel >= 0 ? CharacterMap.symbolForLabel(spaceLabel) : -1;
        this.repeated = repeated;
    }

    /**
     * Builder for UTF-8 mode, where each vocabulary word is a codepoint spelled in bytes.
     *
     * @param characterMap byte alphabet mapping
     * @param workLimit    determinization effort limit (Lucene work units)
     */
    public static DictionaryBuilder forCodepoints(CharacterMap characterMap, int workLimit) {
        return new DictionaryBuilder(characterMap, workLimit, -1, true);
    }

    /**
     * Queues a vocabulary word. Reserved LM tokens, empty words and words the alphabet cannot
     * spell are skipped.
     *
     * @return true if the word was queued
     */
    public boolean addWord(String word) {
        if (word == null || word.isEmpty() || LanguageModelTokens.RESERVED.contains(word)) {
            return false;
        }
        int[] symbols = characterMap.toSymbols(word);
        if (symbols == null) {
            skipped++;
            LOG.debug("Skipping vocabulary word '{}': not representable in alphabet", word);
            return false;
        }
        words.add(symbols);
        return true;
    }

    public int wordCount() {
        return words.size();
    }

    public int skippedCount() {
        return skipped;
    }

    /**
     * Builds the deterministic minimized dictionary from all queued words.
     *
     * @throws CtcDecodeException if determinization exceeds the work limit
     */
    public FrozenDictionary build() {
        long startTime = System.nanoTime();
        Automaton union = new Automaton();
        int start = union.createState();

        List<Integer> heads = new ArrayList<>(words.size());
        for (int[] symbols : words) {
            int head = union.createState();
            int current = head;
            for (int symbol : symbols) {
                int next = union.createState();
                union.addTransition(current, next, symbol);
                current = next;
            }
            union.setAccept(current, true);
            if (spaceSymbol > 0) {
                union.addTransition(current, start, spaceSymbol);
            }
            heads.add(head);
        }
        union.finishState();
        for (int head : heads) {
            union.addEpsilon(start, head);
        }
        union.finishState();

        Automaton minimal;
        try {
            if (repeated) {
                union = Operations.repeat(union);
            }
            Automaton deterministic = Operations.determinize(union, workLimit);
            minimal = MinimizationOperations.minimize(deterministic, workLimit);
        } catch (TooComplexToDeterminizeException e) {
            throw new CtcDecodeException("Vocabulary automaton too complex to determinize within "
                    + workLimit + " work units (" + words.size() + " words)", e);
        }

        FrozenDictionary dictionary = FrozenDictionary.fromAutomaton(minimal);
        long elapsedMs = TimeUtils.elapsedMillis(startTime);
        if (skipped > 0) {
            LOG.warn("Skipped {} vocabulary words not representable in the alphabet", skipped);
        }
        LOG.info("Built vocabulary dictionary: words={}, states={}, transitions={} in {}ms",
                words.size(), dictionary.numStates(), dictionary.numTransitions(), elapsedMs);
        return dictionary;
    }
}
