package com.phillippitts.sessioncore.service.upload.event;

import com.phillippitts.sessioncore.service.upload.AckStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an upload reaches a terminal acknowledgment outcome.
 */
public record UploadFinishedEvent(UUID uploadId, String filename, AckStatus status, Instant at) { }
