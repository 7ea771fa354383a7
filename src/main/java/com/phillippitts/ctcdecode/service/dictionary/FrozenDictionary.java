package com.phillippitts.ctcdecode.service.dictionary;

import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.Transition;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.IntBuffer;

/**
 * Immutable compiled vocabulary acceptor stored as flat int arrays.
 *
 * <p>Serialized form (little-endian int32 words):
 * <pre>
 * numStates, numTransitions, startState,
 * offsets[numStates + 1], min[numTransitions], max[numTransitions], dest[numTransitions],
 * acceptBits[(numStates + 31) / 32]
 * </pre>
 * Transitions of state {@code s} occupy {@code [offsets[s], offsets[s + 1])}, sorted by
 * {@code min} with disjoint ranges.
 *
 * <p>{@link #read(ByteBuffer)} keeps views over the given buffer, so a memory-mapped package
 * is never copied onto the heap.
 */
public final class FrozenDictionary implements VocabularyAutomaton {

    private static final int HEADER_INTS = 3;

    private final int numStates;
    private final int numTransitions;
    private final int start;
    private final IntBuffer offsets;
    private final IntBuffer mins;
    private final IntBuffer maxs;
    private final IntBuffer dests;
    private final IntBuffer acceptBits;

    private FrozenDictionary(int numStates, int numTransitions, int start, IntBuffer offsets,
                             IntBuffer mins, IntBuffer maxs, IntBuffer dests, IntBuffer acceptBits) {
        this.numStates = numStates;
        this.numTransitions = numTransitions;
        this.start = start;
        this.offsets = offsets;
        this.mins = mins;
        this.maxs = maxs;
        this.dests = dests;
        this.acceptBits = acceptBits;
    }

    /**
     * Freezes a deterministic Lucene automaton (state 0 is its initial state).
     *
     * @param automaton deterministic automaton; an automaton with no states becomes a single
     *                  non-accepting start state (empty language)
     * @return frozen copy
     */
    public static FrozenDictionary fromAutomaton(Automaton automaton) {
        int states = Math.max(1, automaton.getNumStates());
        int transitions = automaton.getNumStates() == 0 ? 0 : automaton.getNumTransitions();

        int[] offsets = new int[states + 1];
        int[] mins = new int[transitions];
        int[] maxs = new int[transitions];
        int[] dests = new int[transitions];
        int[] accept = new int[acceptWords(states)];

        int next = 0;
        Transition t = new Transition();
        for (int s = 0; s < automaton.getNumStates(); s++) {
            offsets[s] = next;
            int count = automaton.initTransition(s, t);
            for (int i = 0; i < count; i++) {
                automaton.getNextTransition(t);
                mins[next] = t.min;
                maxs[next] = t.max;
                dests[next] = t.dest;
                next++;
            }
            if (automaton.isAccept(s)) {
                accept[s >>> 5] |= 1 << (s & 31);
            }
        }
        offsets[states] = next;

        return new FrozenDictionary(states, transitions, 0, IntBuffer.wrap(offsets), IntBuffer.wrap(mins),
                IntBuffer.wrap(maxs), IntBuffer.wrap(dests), IntBuffer.wrap(accept));
    }

    /**
     * Reads a serialized dictionary starting at the buffer's position.
     *
     * @param buffer source bytes; read as little-endian regardless of its byte order
     * @return dictionary backed by views of {@code buffer}
     * @throws IllegalArgumentException if the data is truncated or inconsistent
     */
    public static FrozenDictionary read(ByteBuffer buffer) {
        IntBuffer ints = buffer.slice().order(ByteOrder.LITTLE_ENDIAN).asIntBuffer();
        try {
            int numStates = ints.get(0);
            int numTransitions = ints.get(1);
            int start = ints.get(2);
            if (numStates < 1 || numTransitions < 0 || start < 0 || start >= numStates) {
                throw new IllegalArgumentException("Invalid dictionary header: states=" + numStates
                        + ", transitions=" + numTransitions + ", start=" + start);
            }
            long required = HEADER_INTS + (numStates + 1L) + 3L * numTransitions + acceptWords(numStates);
            if (required > ints.limit()) {
                throw new IllegalArgumentException("Dictionary data truncated: need " + required
                        + " ints, have " + ints.limit());
            }
            int pos = HEADER_INTS;
            IntBuffer offsets = ints.slice(pos, numStates + 1);
            pos += numStates + 1;
            IntBuffer mins = ints.slice(pos, numTransitions);
            pos += numTransitions;
            IntBuffer maxs = ints.slice(pos, numTransitions);
            pos += numTransitions;
            IntBuffer dests = ints.slice(pos, numTransitions);
            pos += numTransitions;
            IntBuffer acceptBits = ints.slice(pos, acceptWords(numStates));

            if (offsets.get(0) != 0 || offsets.get(numStates) != numTransitions) {
                throw new IllegalArgumentException("Dictionary transition offsets are inconsistent");
            }
            for (int s = 0; s < numStates; s++) {
                if (offsets.get(s) > offsets.get(s + 1)) {
                    throw new IllegalArgumentException("Dictionary transition offsets decrease at state " + s);
                }
            }
            for (int i = 0; i < numTransitions; i++) {
                int dest = dests.get(i);
                if (dest < 0 || dest >= numStates) {
                    throw new IllegalArgumentException("Dictionary transition " + i + " targets state " + dest
                            + " of " + numStates);
                }
                if (mins.get(i) > maxs.get(i)) {
                    throw new IllegalArgumentException("Dictionary transition " + i + " has an empty label range");
                }
            }
            return new FrozenDictionary(numStates, numTransitions, start, offsets, mins, maxs, dests, acceptBits);
        } catch (IndexOutOfBoundsException | BufferUnderflowException e) {
            throw new IllegalArgumentException("Dictionary data truncated", e);
        }
    }

    private static int acceptWords(int states) {
        return (states + 31) >>> 5;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public int step(int state, int symbol) {
        int lo = offsets.get(state);
        int hi = offsets.get(state + 1) - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (symbol < mins.get(mid)) {
                hi = mid - 1;
            } else if (symbol > maxs.get(mid)) {
                lo = mid + 1;
            } else {
                return dests.get(mid);
            }
        }
        return NO_STATE;
    }

    @Override
    public boolean isAccept(int state) {
        return (acceptBits.get(state >>> 5) & (1 << (state & 31))) != 0;
    }

    @Override
    public int numStates() {
        return numStates;
    }

    public int numTransitions() {
        return numTransitions;
    }

    @Override
    public ByteBuffer serialize() {
        int words = HEADER_INTS + numStates + 1 + 3 * numTransitions + acceptWords(numStates);
        ByteBuffer out = ByteBuffer.allocate(words * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        out.putInt(numStates);
        out.putInt(numTransitions);
        out.putInt(start);
        putAll(out, offsets);
        putAll(out, mins);
        putAll(out, maxs);
        putAll(out, dests);
        putAll(out, acceptBits);
        out.flip();
        return out;
    }

    private static void putAll(ByteBuffer out, IntBuffer values) {
        for (int i = 0; i < values.limit(); i++) {
            out.putInt(values.get(i));
        }
    }

    @Override
    public String toString() {
        return "FrozenDictionary{states=" + numStates + ", transitions=" + numTransitions + "}";
    }
}
