package com.phillippitts.ctcdecode.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LogMathTest {

    @Test
    void addsProbabilitiesInLogSpace() {
        float sum = LogMath.logSumExp((float) Math.log(0.25), (float) Math.log(0.5));
        assertThat((double) sum).isCloseTo(Math.log(0.75), within(1e-6));
    }

    @Test
    void negativeInfinityIsZeroProbability() {
        assertThat(LogMath.logSumExp(Float.NEGATIVE_INFINITY, -2.0f)).isEqualTo(-2.0f);
        assertThat(LogMath.logSumExp(-3.0f, Float.NEGATIVE_INFINITY)).isEqualTo(-3.0f);
        assertThat(LogMath.logSumExp(Float.NEGATIVE_INFINITY, Float.NEGATIVE_INFINITY))
                .isEqualTo(Float.NEGATIVE_INFINITY);
    }

    @Test
    void staysFiniteForVeryNegativeInputs() {
        float sum = LogMath.logSumExp(-1000f, -1000f);
        assertThat((double) sum).isCloseTo(-1000 + Math.log(2), within(1e-3));
    }
}
