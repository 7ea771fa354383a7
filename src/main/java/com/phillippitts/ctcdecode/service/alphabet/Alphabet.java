package com.phillippitts.ctcdecode.service.alphabet;

import com.phillippitts.ctcdecode.exception.CtcDecodeException;
import com.phillippitts.ctcdecode.util.Utf8Utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bidirectional mapping between acoustic-model label ids and their text.
 *
 * <p>Label ids run from {@code 0} to {@code size() - 1}; the CTC blank is the extra id
 * {@code size()}. The label spelled {@code " "} is the word-boundary (space) label.
 *
 * <p>Immutable and safe to share between decoding streams.
 */
public class Alphabet {

    /** Space label value when the alphabet has no {@code " "} entry. */
    public static final int NO_SPACE_LABEL = -2;

    private final List<String> labels;
    private final Map<String, Integer> labelIds;
    private final int spaceLabel;

    /**
     * @param labels label texts in id order (must be unique and non-empty)
     */
    public Alphabet(List<String> labels) {
        Objects.requireNonNull(labels, "labels");
        if (labels.isEmpty()) {
            throw new IllegalArgumentException("Alphabet must contain at least one label");
        }
        Map<String, Integer> ids = new HashMap<>();
        int space = NO_SPACE_LABEL;
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            if (ids.putIfAbsent(label, i) != null) {
                throw new IllegalArgumentException("Duplicate alphabet label '" + label + "' at line " + i);
            }
            if (" ".equals(label)) {
                space = i;
            }
        }
        this.labels = List.copyOf(labels);
        this.labelIds = Collections.unmodifiableMap(ids);
        this.spaceLabel = space;
    }

    /**
     * Loads an alphabet config file: one label per line, {@code #} starts a comment line
     * and {@code \#} stands for a literal {@code #} label.
     *
     * @param configPath path to the alphabet file
     * @return loaded alphabet
     * @throws CtcDecodeException if the file cannot be read or holds no labels
     */
    public static Alphabet fromConfig(Path configPath) {
        try {
            return fromConfigLines(Files.readAllLines(configPath, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CtcDecodeException("Failed to read alphabet config: " + configPath, e);
        }
    }

    /**
     * Parses alphabet config lines (see {@link #fromConfig(Path)}).
     */
    public static Alphabet fromConfigLines(List<String> lines) {
        List<String> labels = new ArrayList<>();
        for (String raw : lines) {
            String line = raw.endsWith("\r") ? raw.substring(0, raw.length() - 1) : raw;
            if (line.equals("\\#")) {
                line = "#";
            } else if (line.startsWith("#") || line.isEmpty()) {
                continue;
            }
            labels.add(line);
        }
        return new Alphabet(labels);
    }

    public int size() {
        return labels.size();
    }

    /** CTC blank label id, one past the last real label. */
    public int blankLabel() {
        return labels.size();
    }

    public int spaceLabel() {
        return spaceLabel;
    }

    /** True for byte-level alphabets whose labels are UTF-8 bytes rather than characters. */
    public boolean isUtf8() {
        return false;
    }

    public String stringFromLabel(int label) {
        if (label < 0 || label >= labels.size()) {
            throw new IllegalArgumentException("Label out of range: " + label + " (size " + labels.size() + ")");
        }
        return labels.get(label);
    }

    /**
     * @return label id for the text, or -1 if the alphabet has no such label
     */
    public int labelFromString(String text) {
        Integer id = labelIds.get(text);
        return id == null ? -1 : id;
    }

    /**
     * Splits a word into the text units that labels are spelled with. Codepoints for
     * character alphabets.
     */
    public List<String> splitIntoUnits(String word) {
        return Utf8Utils.splitIntoCodepoints(word);
    }

    public boolean canEncode(String text) {
        for (String unit : splitIntoUnits(text)) {
            if (!labelIds.containsKey(unit)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Encodes text into label ids.
     *
     * @throws IllegalArgumentException if a unit has no label
     */
    public List<Integer> encode(String text) {
        List<String> units = splitIntoUnits(text);
        List<Integer> out = new ArrayList<>(units.size());
        for (String unit : units) {
            Integer id = labelIds.get(unit);
            if (id == null) {
                throw new IllegalArgumentException("Cannot encode '" + unit + "' with this alphabet");
            }
            out.add(id);
        }
        return out;
    }

    /**
     * UTF-8 bytes of a single label.
     */
    public byte[] decodeSingle(int label) {
        return stringFromLabel(label).getBytes(StandardCharsets.UTF_8);
    }

    public String labelsToString(List<Integer> input) {
        StringBuilder sb = new StringBuilder();
        for (int label : input) {
            sb.append(stringFromLabel(label));
        }
        return sb.toString();
    }
}
