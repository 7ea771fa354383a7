package com.phillippitts.ctcdecode.service.alphabet;

import com.phillippitts.ctcdecode.util.Utf8Utils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Byte-level alphabet used in UTF-8 scoring mode.
 *
 * <p>Label {@code i} stands for byte {@code i + 1}, so there are 255 labels (byte 0 is not
 * representable) and the space byte {@code 0x20} is label 31. Label text is the byte viewed
 * as an ISO-8859-1 character.
 */
public class Utf8Alphabet extends Alphabet {

    private static final int BYTE_LABELS = 255;

    public Utf8Alphabet() {
        super(byteLabels());
    }

    private static List<String> byteLabels() {
        List<String> labels = new ArrayList<>(BYTE_LABELS);
        for (int i = 0; i < BYTE_LABELS; i++) {
            labels.add(String.valueOf((char) (i + 1)));
        }
        return labels;
    }

    @Override
    public boolean isUtf8() {
        return true;
    }

    @Override
    public List<String> splitIntoUnits(String word) {
        return Utf8Utils.splitIntoBytes(word);
    }

    @Override
    public byte[] decodeSingle(int label) {
        if (label < 0 || label >= BYTE_LABELS) {
            throw new IllegalArgumentException("Label out of range: " + label + " (size " + BYTE_LABELS + ")");
        }
        return new byte[]{(byte) (label + 1)};
    }

    @Override
    public String labelsToString(List<Integer> input) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(input.size());
        for (int label : input) {
            bytes.write(decodeSingle(label)[0]);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }
}
