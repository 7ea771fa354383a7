package com.phillippitts.ctcdecode.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void ctcDecodeExceptionShouldIncludeMessage() {
        CtcDecodeException ex = new CtcDecodeException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void ctcDecodeExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        CtcDecodeException ex = new CtcDecodeException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void scorerExceptionShouldExposeErrorCode() {
        ScorerException ex = new ScorerException(ScorerError.MISSING_PACKAGE, "no package");

        assertThat(ex).isInstanceOf(CtcDecodeException.class);
        assertThat(ex.getError()).isEqualTo(ScorerError.MISSING_PACKAGE);
        assertThat(ex.getCode()).isEqualTo(0x2004);
        assertThat(ex.getPath()).isNull();
    }

    @Test
    void scorerExceptionShouldIncludePath() {
        ScorerException ex = new ScorerException(ScorerError.FILE_UNREADABLE, "cannot read", "/models/kenlm.scorer");

        assertThat(ex.getMessage()).contains("cannot read").contains("/models/kenlm.scorer");
        assertThat(ex.getPath()).isEqualTo("/models/kenlm.scorer");
    }

    @Test
    void scorerExceptionShouldIncludePathAndCause() {
        IOException cause = new IOException("disk full");
        ScorerException ex = new ScorerException(ScorerError.PERSIST_FAILURE, "write failed", "/tmp/out", cause);

        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex.getPath()).isEqualTo("/tmp/out");
        assertThat(ex.getCode()).isEqualTo(ScorerError.PERSIST_FAILURE.code());
    }

    @Test
    void errorCodesShouldBeDistinct() {
        assertThat(ScorerError.values())
                .extracting(ScorerError::code)
                .doesNotHaveDuplicates();
        assertThat(ScorerError.VERSION_MISMATCH.hexCode()).isEqualTo("0x2006");
        assertThat(ScorerError.INVALID_ALPHABET_SIZE.code()).isEqualTo(0x2000);
    }
}
