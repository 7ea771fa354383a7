package com.phillippitts.ctcdecode.util;

/**
 * Natural-log probability arithmetic.
 */
public final class LogMath {

    private LogMath() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes {@code log(exp(x) + exp(y))} without overflow; negative infinity stands for
     * probability zero.
     */
    public static float logSumExp(float x, float y) {
        if (x == Float.NEGATIVE_INFINITY) {
            return y;
        }
        if (y == Float.NEGATIVE_INFINITY) {
            return x;
        }
        float max = Math.max(x, y);
        return (float) (max + Math.log(Math.exp(x - max) + Math.exp(y - max)));
    }
}
