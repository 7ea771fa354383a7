package com.phillippitts.ctcdecode.service.lm;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Binary layout of a backoff n-gram model (all numbers little-endian).
 *
 * <pre>
 * offset  field
 * 0       signature      16 ASCII bytes "BACKOFF-NGRAM-LM"
 * 16      format version int32
 * 20      order          int32
 * 24      vocabulary     int32 word count
 * 28      counts         int64 per order (unigrams first)
 * ..      words          per word: int32 byte length + UTF-8 bytes, in id order
 * ..      padding        zero bytes up to a 4-byte boundary
 * ..      tables         per order n: count records of (n x int32 word id, float32 log10 prob,
 *                        float32 log10 backoff), sorted by word ids
 * end     end of model   anything after belongs to other readers
 * </pre>
 */
public final class NgramModelFormat {

    static final byte[] SIGNATURE = "BACKOFF-NGRAM-LM".getBytes(StandardCharsets.US_ASCII);
    static final int FORMAT_VERSION = 1;
    static final int FIXED_HEADER_BYTES = SIGNATURE.length + 3 * Integer.BYTES;

    private NgramModelFormat() {
        // Constants holder - prevent instantiation
    }

    /**
     * Checks the leading bytes of a file against the binary model signature.
     *
     * @param path candidate model file
     * @return true if the file starts with the signature
     * @throws IOException if the file cannot be read
     */
    public static boolean recognizeBinary(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] head = in.readNBytes(SIGNATURE.length);
            return Arrays.equals(head, SIGNATURE);
        }
    }

    static int recordBytes(int n) {
        return n * Integer.BYTES + 2 * Float.BYTES;
    }

    static int padding(long position) {
        int rem = (int) (position % Integer.BYTES);
        return rem == 0 ? 0 : Integer.BYTES - rem;
    }
}
