/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend a common base so the presentation layer can map them consistently.
 * Races that belong to normal operation (a late acknowledgment after a timeout, losing a window
 * claim) are never exceptions; only misuse and resource limits are.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.sessioncore.exception.SessionCoreException} - Base exception</li>
 *   <li>{@link com.phillippitts.sessioncore.exception.DuplicateRequestKeyException} - a second
 *       request registered under a key that is still pending</li>
 *   <li>{@link com.phillippitts.sessioncore.exception.UploadRejectedException} - caller-side
 *       upload validation failed (file missing, too large, not connected)</li>
 *   <li>{@link com.phillippitts.sessioncore.exception.QueueStoreException} - the persistent store
 *       rejected a priority queue write</li>
 *   <li>{@link com.phillippitts.sessioncore.exception.QueueEntryNotFoundException} - the session
 *       is not in the priority queue</li>
 * </ul>
 *
 * @see com.phillippitts.sessioncore.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.sessioncore.exception;
