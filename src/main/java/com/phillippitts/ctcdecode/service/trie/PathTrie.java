package com.phillippitts.ctcdecode.service.trie;

import com.phillippitts.ctcdecode.exception.ScorerError;
import com.phillippitts.ctcdecode.exception.ScorerExceptionBuilder;
import com.phillippitts.ctcdecode.service.alphabet.Alphabet;
import com.phillippitts.ctcdecode.service.alphabet.CharacterMap;
import com.phillippitts.ctcdecode.service.dictionary.VocabularyAutomaton;
import com.phillippitts.ctcdecode.util.LogMath;
import com.phillippitts.ctcdecode.util.Utf8Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of the prefix tree shared by all hypotheses of one decoding stream.
 *
 * <p>Each node stores one label and a strong reference to its parent, so a hypothesis keeps
 * its whole prefix reachable. Words and graphemes are rebuilt on demand by walking parents;
 * the child index exists only to share prefixes when a hypothesis is extended.
 *
 * <p>Score fields are natural-log probabilities owned by the decoder:
 * <ul>
 *   <li>{@code logProbBPrev}/{@code logProbNbPrev}: prefix ending in blank / non-blank at the previous frame</li>
 *   <li>{@code logProbBCur}/{@code logProbNbCur}: the same, accumulating for the current frame</li>
 *   <li>{@code logProbC}: best acoustic probability seen for this node's label</li>
 *   <li>{@code score}: combined ranking score</li>
 * </ul>
 *
 * <p>Not thread-safe: a tree belongs to exactly one stream.
 */
public final class PathTrie {

    public static final int ROOT = -1;

    private final int character;
    private final PathTrie parent;
    private final VocabularyAutomaton dictionary;
    private int dictionaryState;
    private int timestep;

    private float logProbBPrev = Float.NEGATIVE_INFINITY;
    private float logProbNbPrev = Float.NEGATIVE_INFINITY;
    private float logProbBCur = Float.NEGATIVE_INFINITY;
    private float logProbNbCur = Float.NEGATIVE_INFINITY;
    private float logProbC = Float.NEGATIVE_INFINITY;
    private float score = Float.NEGATIVE_INFINITY;

    private boolean active = true;
    private Map<Integer, PathTrie> children;

    private PathTrie(int character, int timestep, PathTrie parent, VocabularyAutomaton dictionary,
                     int dictionaryState) {
        this.character = character;
        this.timestep = timestep;
        this.parent = parent;
        this.dictionary = dictionary;
        this.dictionaryState = dictionaryState;
    }

    /**
     * Creates an unconstrained root (every label sequence allowed).
     */
    public static PathTrie root() {
        return root(null);
    }

    /**
     * Creates a root whose descendants must follow {@code dictionary}.
     *
     * @param dictionary vocabulary constraint, or null for none
     */
    public static PathTrie root(VocabularyAutomaton dictionary) {
        PathTrie root = new PathTrie(ROOT, 0, null, dictionary,
                dictionary == null ? VocabularyAutomaton.NO_STATE : dictionary.start());
        root.logProbBPrev = 0.0f;
        root.score = 0.0f;
        return root;
    }

    /**
     * Returns the child for {@code label}, creating it when missing.
     *
     * <p>An existing child keeps the better of its own and the new acoustic probability; an
     * inactive child is revived with cleared prefix probabilities.
     *
     * @param label    label id of the extension
     * @param timestep frame index the label was emitted at
     * @param logProbC acoustic log probability of the label at that frame
     * @return child node, or null when the vocabulary automaton rejects the extension
     */
    public PathTrie extend(int label, int timestep, float logProbC) {
        PathTrie child = children == null ? null : children.get(label);
        if (child != null) {
            if (child.logProbC < logProbC) {
                child.logProbC = logProbC;
                child.timestep = timestep;
            }
            if (!child.active) {
                child.active = true;
                child.logProbBPrev = Float.NEGATIVE_INFINITY;
                child.logProbNbPrev = Float.NEGATIVE_INFINITY;
                child.logProbBCur = Float.NEGATIVE_INFINITY;
                child.logProbNbCur = Float.NEGATIVE_INFINITY;
            }
            return child;
        }

        int nextState = VocabularyAutomaton.NO_STATE;
        if (dictionary != null) {
            nextState = dictionary.step(dictionaryState, CharacterMap.symbolForLabel(label));
            if (nextState == VocabularyAutomaton.NO_STATE) {
                return null;
            }
        }
        child = new PathTrie(label, timestep, this, dictionary, nextState);
        child.logProbC = logProbC;
        if (children == null) {
            children = new HashMap<>(4);
        }
        children.put(label, child);
        return child;
    }

    /**
     * Collects the labels of the word ending at this node, oldest first.
     *
     * @param output     receives word labels
     * @param timesteps  receives the matching timesteps
     * @param spaceLabel word separator label
     * @return first node of the word, or this node when it is the root or a separator
     */
    public PathTrie getPrevWord(List<Integer> output, List<Integer> timesteps, int spaceLabel) {
        List<PathTrie> nodes = new ArrayList<>();
        PathTrie node = this;
        while (node.character != ROOT && node.character != spaceLabel) {
            nodes.add(node);
            if (node.parent.character == ROOT || node.parent.character == spaceLabel) {
                break;
            }
            node = node.parent;
        }
        appendReversed(nodes, output, timesteps);
        return node;
    }

    /**
     * Collects the byte labels of the UTF-8 codepoint ending at this node, lead byte first.
     *
     * @return node holding the lead byte, or this node when it is the root
     */
    public PathTrie getPrevGrapheme(List<Integer> output, List<Integer> timesteps, Alphabet alphabet) {
        List<PathTrie> nodes = new ArrayList<>(4);
        PathTrie node = this;
        while (node.character != ROOT) {
            nodes.add(node);
            if (Utf8Utils.isCodepointBoundary(node.leadByte(alphabet)) || node.parent.character == ROOT) {
                break;
            }
            node = node.parent;
        }
        appendReversed(nodes, output, timesteps);
        return node;
    }

    private static void appendReversed(List<PathTrie> nodes, List<Integer> output, List<Integer> timesteps) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            output.add(nodes.get(i).character);
            timesteps.add(nodes.get(i).timestep);
        }
    }

    /**
     * Counts bytes from the nearest codepoint lead byte down to this node, inclusive.
     *
     * @return distance and the lead byte found
     * @throws com.phillippitts.ctcdecode.exception.ScorerException with
     *         {@link ScorerError#INTERNAL_INCONSISTENCY} if the root is reached first
     */
    public CodepointBoundary distanceToCodepointBoundary(Alphabet alphabet) {
        int distance = 1;
        PathTrie node = this;
        while (node.character != ROOT) {
            int b = node.leadByte(alphabet);
            if (Utf8Utils.isCodepointBoundary(b)) {
                return new CodepointBoundary(distance, b);
            }
            node = node.parent;
            distance++;
        }
        throw ScorerExceptionBuilder.create(ScorerError.INTERNAL_INCONSISTENCY,
                        "No codepoint lead byte before the root of the prefix tree")
                .metadata("bytes", distance - 1)
                .build();
    }

    /**
     * Whether a byte label can follow this node in well-formed UTF-8: a continuation byte
     * while the current codepoint is incomplete, otherwise a lead byte.
     *
     * @param label    byte label of a UTF-8 alphabet
     * @param alphabet byte alphabet
     */
    public boolean acceptsUtf8Byte(int label, Alphabet alphabet) {
        int b = alphabet.decodeSingle(label)[0] & 0xFF;
        if (character != ROOT) {
            CodepointBoundary boundary = distanceToCodepointBoundary(alphabet);
            if (boundary.distance() < Utf8Utils.sequenceLength(boundary.leadByte())) {
                return !Utf8Utils.isCodepointBoundary(b);
            }
        }
        return Utf8Utils.sequenceLength(b) > 0;
    }

    private int leadByte(Alphabet alphabet) {
        return alphabet.decodeSingle(character)[0] & 0xFF;
    }

    /**
     * Labels from the root down to this node.
     */
    public PathTrie getPathVec(List<Integer> output, List<Integer> timesteps) {
        List<PathTrie> nodes = new ArrayList<>();
        for (PathTrie node = this; node.character != ROOT; node = node.parent) {
            nodes.add(node);
        }
        appendReversed(nodes, output, timesteps);
        return this;
    }

    /**
     * Moves current-frame probabilities into the previous-frame slots and recomputes the score.
     */
    public void updateScores() {
        logProbBPrev = logProbBCur;
        logProbNbPrev = logProbNbCur;
        logProbBCur = Float.NEGATIVE_INFINITY;
        logProbNbCur = Float.NEGATIVE_INFINITY;
        score = LogMath.logSumExp(logProbBPrev, logProbNbPrev);
    }

    /**
     * Drops this node from the beam. Childless nodes detach from their parent, cascading
     * upwards through parents that are inactive and left without children.
     */
    public void remove() {
        PathTrie node = this;
        node.active = false;
        while (node.parent != null && !node.active && (node.children == null || node.children.isEmpty())) {
            PathTrie up = node.parent;
            up.children.remove(node.character);
            node = up;
        }
    }

    public boolean isActive() {
        return active;
    }

    public boolean isRoot() {
        return character == ROOT;
    }

    public int character() {
        return character;
    }

    public int timestep() {
        return timestep;
    }

    public PathTrie parent() {
        return parent;
    }

    public boolean hasDictionary() {
        return dictionary != null;
    }

    /** Child lookup for a label, or null. */
    public PathTrie child(int label) {
        return children == null ? null : children.get(label);
    }

    Map<Integer, PathTrie> children() {
        return children == null ? Collections.emptyMap() : children;
    }

    public float logProbBPrev() {
        return logProbBPrev;
    }

    public void setLogProbBPrev(float value) {
        this.logProbBPrev = value;
    }

    public float logProbNbPrev() {
        return logProbNbPrev;
    }

    public void setLogProbNbPrev(float value) {
        this.logProbNbPrev = value;
    }

    public float logProbBCur() {
        return logProbBCur;
    }

    public void setLogProbBCur(float value) {
        this.logProbBCur = value;
    }

    public float logProbNbCur() {
        return logProbNbCur;
    }

    public void setLogProbNbCur(float value) {
        this.logProbNbCur = value;
    }

    public float logProbC() {
        return logProbC;
    }

    public float score() {
        return score;
    }

    public void setScore(float score) {
        this.score = score;
    }

    /**
     * Position of the nearest codepoint lead byte: {@code distance} bytes from the node
     * (1 when the node itself is the lead byte).
     */
    public record CodepointBoundary(int distance, int leadByte) {
    }
}
