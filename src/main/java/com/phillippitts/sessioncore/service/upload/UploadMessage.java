package com.phillippitts.sessioncore.service.upload;

import java.util.Objects;

/**
 * Outbound upload request.
 *
 * @param requestId       identifier the backend echoes in its acknowledgment (null until the
 *                        coordinator registers the request)
 * @param filename        resource name as the user sees it
 * @param content         base64-encoded file content
 * @param storageLocation backend directory the file is written to
 */
public record UploadMessage(String requestId, String filename, String content, String storageLocation) {

    public UploadMessage {
        Objects.requireNonNull(filename, "filename must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(storageLocation, "storageLocation must not be null");
    }

    public static UploadMessage of(String filename, String content, String storageLocation) {
        return new UploadMessage(null, filename, content, storageLocation);
    }

    public UploadMessage withRequestId(String id) {
        return new UploadMessage(id, filename, content, storageLocation);
    }
}
