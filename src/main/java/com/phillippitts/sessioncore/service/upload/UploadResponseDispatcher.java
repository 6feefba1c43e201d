package com.phillippitts.sessioncore.service.upload;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for inbound transport messages that may acknowledge an upload.
 *
 * <p>Routing order:
 * <ol>
 *   <li>echoed request id: authoritative; if it matches nothing the response is late and dropped</li>
 *   <li>exact filename</li>
 *   <li>fallback match against the single pending request (backend renamed the file)</li>
 * </ol>
 */
@Component
public class UploadResponseDispatcher {

    private static final Logger LOG = LogManager.getLogger(UploadResponseDispatcher.class);

    private final UploadMessageCodec codec;
    private final AckCoordinator coordinator;

    public UploadResponseDispatcher(UploadMessageCodec codec, AckCoordinator coordinator) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    }

    /**
     * Handles one inbound message.
     *
     * @param json inbound JSON text
     * @return true if the message resolved a pending upload
     */
    public boolean onMessage(String json) {
        Optional<UploadResponse> decoded = codec.decodeResponse(json);
        if (decoded.isEmpty()) {
            return false;
        }
        return dispatch(decoded.get());
    }

    boolean dispatch(UploadResponse response) {
        LOG.info("Upload response: filename={}, success={}", response.filename(), response.success());
        if (response.requestId() != null) {
            return coordinator.resolveByRequestId(response.requestId(), response.status());
        }
        if (coordinator.resolve(response.filename(), response.status())) {
            return true;
        }
        return coordinator.resolveByFallbackMatch(response.filename(), response.status());
    }
}
