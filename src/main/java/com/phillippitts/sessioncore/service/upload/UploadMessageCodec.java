package com.phillippitts.sessioncore.service.upload;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JSON codec for upload messages exchanged with the backend.
 *
 * <p>Outbound: {@code {"type":"upload_file","filename":...,"content":...,"storage_location":...,
 * "request_id":...}}.
 *
 * <p>Inbound, two shapes are recognized:
 * <ul>
 *   <li>{@code file-uploaded} / {@code file_uploaded} with a {@code filename}: success</li>
 *   <li>{@code error} with a {@code filename}: failure of that upload</li>
 * </ul>
 * An explicit {@code success} boolean, when present, overrides the type-derived value.
 * Every other message type is not an upload response and decodes to empty.
 *
 * <p>Thread-safe: stateless.
 */
@Component
public class UploadMessageCodec {

    private static final Logger LOG = LogManager.getLogger(UploadMessageCodec.class);

    static final String TYPE_UPLOAD = "upload_file";
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_FILENAME = "filename";
    private static final String FIELD_CONTENT = "content";
    private static final String FIELD_STORAGE_LOCATION = "storage_location";
    private static final String FIELD_REQUEST_ID = "request_id";
    private static final String FIELD_SUCCESS = "success";

    /**
     * Encodes an upload request.
     *
     * @param message the request; its request id is omitted when null
     * @return JSON text
     */
    public String encode(UploadMessage message) {
        JSONObject obj = new JSONObject();
        obj.put(FIELD_TYPE, TYPE_UPLOAD);
        obj.put(FIELD_FILENAME, message.filename());
        obj.put(FIELD_CONTENT, message.content());
        obj.put(FIELD_STORAGE_LOCATION, message.storageLocation());
        if (message.requestId() != null) {
            obj.put(FIELD_REQUEST_ID, message.requestId());
        }
        return obj.toString();
    }

    /**
     * Decodes an inbound message if it is an upload acknowledgment.
     *
     * @param json inbound JSON text
     * @return the acknowledgment, or empty for unrelated, malformed or filename-less messages
     */
    public Optional<UploadResponse> decodeResponse(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            LOG.warn("Ignoring malformed inbound message: {}", e.getMessage());
            return Optional.empty();
        }

        String type = obj.optString(FIELD_TYPE, "");
        boolean success;
        switch (type) {
            case "file-uploaded", "file_uploaded" -> success = true;
            case "error" -> success = false;
            default -> {
                return Optional.empty();
            }
        }

        String filename = obj.optString(FIELD_FILENAME, null);
        if (filename == null || filename.isBlank()) {
            // Errors unrelated to uploads carry no filename
            return Optional.empty();
        }
        if (obj.has(FIELD_SUCCESS)) {
            success = obj.optBoolean(FIELD_SUCCESS, success);
        }
        String requestId = obj.optString(FIELD_REQUEST_ID, null);
        if (requestId != null && requestId.isBlank()) {
            requestId = null;
        }
        return Optional.of(new UploadResponse(filename, success, requestId));
    }
}
