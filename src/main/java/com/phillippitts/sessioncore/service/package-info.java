/**
 * Coordination services.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.upload} - request/acknowledgment correlation with timeout, and the upload
 *       pipeline built on it</li>
 *   <li>{@code service.window} - which window shows which session</li>
 *   <li>{@code service.queue} - drag-reorderable priority queue with fractional order keys</li>
 *   <li>{@code service.health}, {@code service.metrics}, {@code service.events} - actuator,
 *       Micrometer and log output for the above</li>
 * </ul>
 *
 * <p>Each stateful service has one serialization point (an atomic map removal or a lock) and
 * publishes Spring application events after leaving it. Services throw domain exceptions from
 * {@code com.phillippitts.sessioncore.exception}, never HTTP exceptions.
 *
 * @since 1.0
 */
package com.phillippitts.sessioncore.service;
