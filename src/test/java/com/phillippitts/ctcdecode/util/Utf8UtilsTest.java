package com.phillippitts.ctcdecode.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class Utf8UtilsTest {

    @ParameterizedTest
    @CsvSource({
            "0x41, 1",
            "0x7F, 1",
            "0xC3, 2",
            "0xE2, 3",
            "0xF0, 4",
            "0x80, -1",
            "0xBF, -1",
            "0xF8, -1",
            "0xFF, -1"
    })
    void sequenceLengthFollowsLeadByteHighBits(String lead, int expected) {
        assertThat(Utf8Utils.sequenceLength(Integer.decode(lead))).isEqualTo(expected);
    }

    @Test
    void continuationBytesAreNotBoundaries() {
        assertThat(Utf8Utils.isCodepointBoundary(0x41)).isTrue();
        assertThat(Utf8Utils.isCodepointBoundary(0xE2)).isTrue();
        assertThat(Utf8Utils.isCodepointBoundary(0x82)).isFalse();
        assertThat(Utf8Utils.isCodepointBoundary(0xAC)).isFalse();
    }

    @Test
    void splitsCodepointsIncludingSupplementaryCharacters() {
        assertThat(Utf8Utils.splitIntoCodepoints("a€😀")).containsExactly("a", "€", "😀");
        assertThat(Utf8Utils.splitIntoCodepoints("")).isEmpty();
        assertThat(Utf8Utils.splitIntoCodepoints(null)).isEmpty();
    }

    @Test
    void splitsIntoUtf8Bytes() {
        assertThat(Utf8Utils.splitIntoBytes("é"))
                .containsExactly(String.valueOf((char) 0xC3), String.valueOf((char) 0xA9));
        assertThat(Utf8Utils.splitIntoBytes("ab")).containsExactly("a", "b");
    }
}
