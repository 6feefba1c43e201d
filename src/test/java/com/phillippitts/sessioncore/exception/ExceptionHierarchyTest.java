package com.phillippitts.sessioncore.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void sessionCoreExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        SessionCoreException ex = new SessionCoreException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void duplicateRequestKeyExceptionShouldIncludeKey() {
        DuplicateRequestKeyException ex = new DuplicateRequestKeyException("a.txt");

        assertThat(ex.getKey()).isEqualTo("a.txt");
        assertThat(ex.getMessage()).contains("a.txt");
    }

    @Test
    void uploadRejectedExceptionShouldIncludeReasonAndFilename() {
        UploadRejectedException ex = new UploadRejectedException(
                UploadRejectedException.Reason.SIZE_LIMIT_EXCEEDED, "big.bin", "File too large");

        assertThat(ex.getReason()).isEqualTo(UploadRejectedException.Reason.SIZE_LIMIT_EXCEEDED);
        assertThat(ex.getFilename()).isEqualTo("big.bin");
        assertThat(ex.getMessage()).contains("File too large").contains("big.bin");
    }

    @Test
    void queueEntryNotFoundExceptionShouldIncludeSessionId() {
        UUID id = UUID.randomUUID();
        QueueEntryNotFoundException ex = new QueueEntryNotFoundException(id);

        assertThat(ex.getSessionId()).isEqualTo(id);
        assertThat(ex.getMessage()).contains(id.toString());
    }

    @Test
    void allExceptionsShouldBeUnchecked() {
        assertThat(new SessionCoreException("x")).isInstanceOf(RuntimeException.class);
        assertThat(new DuplicateRequestKeyException("k")).isInstanceOf(SessionCoreException.class);
        assertThat(new UploadRejectedException(UploadRejectedException.Reason.NOT_CONNECTED, "*", "x"))
                .isInstanceOf(SessionCoreException.class);
        assertThat(new QueueStoreException("x")).isInstanceOf(SessionCoreException.class);
        assertThat(new QueueEntryNotFoundException(UUID.randomUUID())).isInstanceOf(SessionCoreException.class);
    }
}
