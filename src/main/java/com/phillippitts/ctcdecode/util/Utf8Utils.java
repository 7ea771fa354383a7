package com.phillippitts.ctcdecode.util;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Byte-level UTF-8 helpers used by grapheme-mode scoring.
 *
 * <p>Byte values are passed as {@code int} in the range 0..255.
 */
public final class Utf8Utils {

    private Utf8Utils() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns true when the byte starts a codepoint (i.e. is not a {@code 10xxxxxx} continuation byte).
     */
    public static boolean isCodepointBoundary(int b) {
        return (b & 0xC0) != 0x80;
    }

    /**
     * Number of bytes a sequence starting with this lead byte occupies.
     *
     * @param leadByte first byte of an encoded codepoint
     * @return 1 to 4, or -1 if the byte cannot start a well-formed sequence
     */
    public static int sequenceLength(int leadByte) {
        int b = leadByte & 0xFF;
        if ((b >> 7) == 0x00) {
            return 1;
        }
        if ((b >> 5) == 0x06) {
            return 2;
        }
        if ((b >> 4) == 0x0E) {
            return 3;
        }
        if ((b >> 3) == 0x1E) {
            return 4;
        }
        return -1;
    }

    /**
     * Splits text into one string per Unicode codepoint.
     *
     * @param text input (may be null)
     * @return codepoint strings in order, empty for null or empty input
     */
    public static List<String> splitIntoCodepoints(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> units = new ArrayList<>(text.length());
        text.codePoints().forEach(cp -> units.add(new String(Character.toChars(cp))));
        return units;
    }

    /**
     * Splits text into its UTF-8 bytes, each returned as a one-character ISO-8859-1 string.
     * This is how byte labels are spelled in a byte-level alphabet.
     */
    public static List<String> splitIntoBytes(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        List<String> units = new ArrayList<>(bytes.length);
        for (byte b : bytes) {
            units.add(String.valueOf((char) (b & 0xFF)));
        }
        return units;
    }
}
