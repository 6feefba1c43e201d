/**
 * Upload pipeline and the acknowledgment coordinator it rests on.
 *
 * <p>{@link com.phillippitts.sessioncore.service.upload.AckCoordinator} is generic over the
 * payload: it registers a pending completion under a key, hands the message to the
 * {@link com.phillippitts.sessioncore.service.upload.UploadTransport}, and completes the caller's
 * future exactly once with whichever comes first, the acknowledgment or the timeout.
 * {@link com.phillippitts.sessioncore.service.upload.UploadService} adds file validation,
 * progress tracking and metrics on top.
 */
package com.phillippitts.sessioncore.service.upload;
