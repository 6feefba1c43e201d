package com.phillippitts.sessioncore.service.upload;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Transport used until a real backend connection is wired in. Uploads are rejected up front with
 * {@code NOT_CONNECTED}; a direct {@link #send(String)} fails, which the coordinator reports as
 * {@link AckStatus#TRANSPORT_FAILURE}.
 */
public class DisconnectedUploadTransport implements UploadTransport {

    private static final Logger LOG = LogManager.getLogger(DisconnectedUploadTransport.class);

    @Override
    public boolean isConnected() {
        return false;
    }

    @Override
    public void send(String message) {
        throw new IllegalStateException("No upload transport connected");
    }

    @Override
    public CompletableFuture<Boolean> testConnection(Duration timeout) {
        LOG.debug("Connection test against disconnected transport");
        return CompletableFuture.completedFuture(false);
    }
}
