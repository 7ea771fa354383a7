package com.phillippitts.ctcdecode.service.lm;

import java.nio.ByteBuffer;

/**
 * Sorted fixed-width records of one n-gram order, searched in place.
 *
 * <p>Only absolute reads are used on the backing buffer, so a table can be shared by
 * concurrent readers.
 */
final class NgramTable {

    private final ByteBuffer records;
    private final int n;
    private final int count;
    private final int recordBytes;

    NgramTable(ByteBuffer records, int n, int count) {
        this.records = records;
        this.n = n;
        this.count = count;
        this.recordBytes = NgramModelFormat.recordBytes(n);
    }

    /**
     * Binary search for the n-gram {@code words[from..to)} where {@code to - from == n}.
     *
     * @return record index, or -1 when absent
     */
    int find(int[] words, int from, int to) {
        int lo = 0;
        int hi = count - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int cmp = compare(mid, words, from, to);
            if (cmp < 0) {
                lo = mid + 1;
            } else if (cmp > 0) {
                hi = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }

    float log10Prob(int index) {
        return records.getFloat(index * recordBytes + n * Integer.BYTES);
    }

    float backoff(int index) {
        return records.getFloat(index * recordBytes + n * Integer.BYTES + Float.BYTES);
    }

    private int compare(int index, int[] words, int from, int to) {
        int base = index * recordBytes;
        for (int i = 0; i < to - from; i++) {
            int stored = records.getInt(base + i * Integer.BYTES);
            int wanted = words[from + i];
            if (stored != wanted) {
                return stored < wanted ? -1 : 1;
            }
        }
        return 0;
    }
}
