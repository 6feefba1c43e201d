package com.phillippitts.sessioncore.service.upload;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Message transport to the backend (external collaborator).
 *
 * <p>Sending is fire-and-forget. Acknowledgments arrive later as inbound messages, which the
 * transport hands to {@link UploadResponseDispatcher#onMessage(String)}.
 */
public interface UploadTransport {

    /**
     * @return true if the transport currently has a live connection
     */
    boolean isConnected();

    /**
     * Sends an encoded message.
     *
     * @param message JSON text
     * @throws RuntimeException if the transport cannot accept the message
     */
    void send(String message);

    /**
     * Probes the backend.
     *
     * @param timeout how long the probe may take
     * @return future completing with true when the backend answered in time
     */
    CompletableFuture<Boolean> testConnection(Duration timeout);
}
