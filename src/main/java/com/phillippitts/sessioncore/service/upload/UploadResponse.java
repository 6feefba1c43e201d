package com.phillippitts.sessioncore.service.upload;

/**
 * Inbound upload acknowledgment.
 *
 * @param filename  name the backend stored the file under (may differ from the name sent when the
 *                  backend renamed it to avoid a collision)
 * @param success   whether the backend accepted the upload
 * @param requestId echoed request identifier, or null for backends that do not echo it
 */
public record UploadResponse(String filename, boolean success, String requestId) {

    public AckStatus status() {
        return success ? AckStatus.ACKNOWLEDGED : AckStatus.REJECTED;
    }
}
