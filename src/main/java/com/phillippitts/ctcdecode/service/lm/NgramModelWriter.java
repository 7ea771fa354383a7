package com.phillippitts.ctcdecode.service.lm;

import com.phillippitts.ctcdecode.exception.CtcDecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Writes an {@link ArpaModel} in the binary layout described by {@link NgramModelFormat}.
 */
public final class NgramModelWriter {

    private static final Logger LOG = LogManager.getLogger(NgramModelWriter.class);

    private static final Comparator<ArpaModel.Entry> BY_WORDS =
            (a, b) -> Arrays.compare(a.words(), b.words());

    private NgramModelWriter() {
        // Utility class - prevent instantiation
    }

    /**
     * Writes the model, replacing any existing file.
     *
     * @param model  parsed model
     * @param target output file
     * @return end-of-model offset (the file length)
     * @throws IOException if the file cannot be written
     */
    public static long write(ArpaModel model, Path target) throws IOException {
        ByteBuffer buffer = encode(model);
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
        LOG.info("Wrote binary language model '{}' ({} bytes, order {})", target, buffer.limit(), model.order());
        return buffer.limit();
    }

    static ByteBuffer encode(ArpaModel model) {
        int order = model.order();
        List<byte[]> words = new ArrayList<>(model.vocabulary().size());
        long size = NgramModelFormat.FIXED_HEADER_BYTES + (long) order * Long.BYTES;
        for (String word : model.vocabulary()) {
            byte[] utf8 = word.getBytes(StandardCharsets.UTF_8);
            words.add(utf8);
            size += Integer.BYTES + utf8.length;
        }
        size += NgramModelFormat.padding(size);

        List<List<ArpaModel.Entry>> sorted = new ArrayList<>(order);
        for (int n = 1; n <= order; n++) {
            List<ArpaModel.Entry> entries = new ArrayList<>(model.ngrams().get(n - 1));
            entries.sort(BY_WORDS);
            for (int i = 1; i < entries.size(); i++) {
                if (BY_WORDS.compare(entries.get(i - 1), entries.get(i)) == 0) {
                    throw new CtcDecodeException("Duplicate " + n + "-gram in model: "
                            + Arrays.toString(entries.get(i).words()));
                }
            }
            sorted.add(entries);
            size += (long) entries.size() * NgramModelFormat.recordBytes(n);
        }
        if (size > Integer.MAX_VALUE) {
            throw new CtcDecodeException("Language model too large for binary format: " + size + " bytes");
        }

        ByteBuffer out = ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
        out.put(NgramModelFormat.SIGNATURE);
        out.putInt(NgramModelFormat.FORMAT_VERSION);
        out.putInt(order);
        out.putInt(words.size());
        for (List<ArpaModel.Entry> entries : sorted) {
            out.putLong(entries.size());
        }
        for (byte[] word : words) {
            out.putInt(word.length);
            out.put(word);
        }
        for (int i = NgramModelFormat.padding(out.position()); i > 0; i--) {
            out.put((byte) 0);
        }
        for (List<ArpaModel.Entry> entries : sorted) {
            for (ArpaModel.Entry entry : entries) {
                for (int id : entry.words()) {
                    out.putInt(id);
                }
                out.putFloat(entry.log10Prob());
                out.putFloat(entry.backoff());
            }
        }
        out.flip();
        return out;
    }
}
