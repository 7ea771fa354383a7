package com.phillippitts.ctcdecode.service.alphabet;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps alphabet text units to vocabulary automaton input symbols.
 *
 * <p>Symbol = label id + 1: state 0 is the automaton start state, so symbols start at 1.
 * Rebuilt whenever the scorer's alphabet changes; read-only afterwards.
 */
public final class CharacterMap {

    private final Alphabet alphabet;
    private final Map<String, Integer> symbols;

    public CharacterMap(Alphabet alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        Map<String, Integer> map = new HashMap<>(alphabet.size() * 2);
        for (int i = 0; i < alphabet.size(); i++) {
            map.put(alphabet.stringFromLabel(i), i + 1);
        }
        this.symbols = Map.copyOf(map);
    }

    public static int symbolForLabel(int label) {
        return label + 1;
    }

    /**
     * @return symbol for a text unit, or -1 when the alphabet cannot spell it
     */
    public int symbolFor(String unit) {
        Integer symbol = symbols.get(unit);
        return symbol == null ? -1 : symbol;
    }

    /**
     * Converts a word into automaton symbols.
     *
     * @param word vocabulary word
     * @return symbols in order, or {@code null} if any unit is missing from the alphabet
     */
    public int[] toSymbols(String word) {
        List<String> units = alphabet.splitIntoUnits(word);
        int[] out = new int[units.size()];
        for (int i = 0; i < out.length; i++) {
            int symbol = symbolFor(units.get(i));
            if (symbol < 0) {
                return null;
            }
            out[i] = symbol;
        }
        return out;
    }

    public int size() {
        return symbols.size();
    }
}
