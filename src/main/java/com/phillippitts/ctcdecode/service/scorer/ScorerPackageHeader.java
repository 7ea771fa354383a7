package com.phillippitts.ctcdecode.service.scorer;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Fixed-width header written between the language model and the dictionary blob.
 *
 * <pre>
 * offset  field      type
 * 0       magic      int32   0x54524945 ('TRIE')
 * 4       version    int32
 * 8       utf8Mode   byte    0 or 1
 * 9       alpha      float64
 * 17      beta       float64
 * 25      dictionary blob
 * </pre>
 * All numbers are little-endian.
 */
record ScorerPackageHeader(int magic, int version, boolean utf8Mode, double alpha, double beta) {

    static final int MAGIC_BYTES = Integer.BYTES;
    static final int PREFIX_BYTES = 2 * Integer.BYTES;
    static final int BYTES = PREFIX_BYTES + 1 + 2 * Double.BYTES;

    /**
     * Reads the parameter part of the header; magic and version must already be validated
     * and the buffer positioned right after them.
     */
    static ScorerPackageHeader readParameters(int magic, int version, ByteBuffer buffer) {
        boolean utf8 = buffer.get() != 0;
        double alpha = buffer.getDouble();
        double beta = buffer.getDouble();
        return new ScorerPackageHeader(magic, version, utf8, alpha, beta);
    }

    ByteBuffer encode() {
        ByteBuffer out = ByteBuffer.allocate(BYTES).order(ByteOrder.LITTLE_ENDIAN);
        out.putInt(magic);
        out.putInt(version);
        out.put((byte) (utf8Mode ? 1 : 0));
        out.putDouble(alpha);
        out.putDouble(beta);
        out.flip();
        return out;
    }
}
