package com.phillippitts.sessioncore.presentation.exception;

import com.phillippitts.sessioncore.exception.DuplicateRequestKeyException;
import com.phillippitts.sessioncore.exception.QueueEntryNotFoundException;
import com.phillippitts.sessioncore.exception.QueueStoreException;
import com.phillippitts.sessioncore.exception.UploadRejectedException;
import com.phillippitts.sessioncore.exception.UploadRejectedException.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesDuplicateKeyReturns409() {
        ResponseEntity<?> response = handler.handleDuplicateKey(new DuplicateRequestKeyException("a.txt"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("DuplicateRequestKeyException");
    }

    @Test
    void verifiesFileProblemsReturn400() {
        for (Reason reason : new Reason[]{Reason.FILE_NOT_FOUND, Reason.SIZE_LIMIT_EXCEEDED, Reason.UNREADABLE}) {
            ResponseEntity<?> response = handler.handleUploadRejected(
                    new UploadRejectedException(reason, "a.txt", "bad file"));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }
    }

    @Test
    void verifiesUnavailableUploadServiceReturns503() {
        ResponseEntity<?> response = handler.handleUploadRejected(
                new UploadRejectedException(Reason.NOT_CONNECTED, "*", "Not connected to server"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("Upload service unavailable");
    }

    @Test
    void verifiesQueueEntryNotFoundReturns404() {
        ResponseEntity<?> response = handler.handleQueueEntryNotFound(new QueueEntryNotFoundException(UUID.randomUUID()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void verifiesQueueStoreFailureReturns503WithoutInternalDetails() {
        ResponseEntity<?> response = handler.handleQueueStore(
                new QueueStoreException("jdbc:postgresql://db-internal:5432 refused"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("retry");
        assertThat(response.getBody().toString()).doesNotContain("db-internal");
    }

    @Test
    void verifiesUnexpectedReturns500() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("Bad state"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("Bad state");
        assertThat(response.getBody().toString()).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
