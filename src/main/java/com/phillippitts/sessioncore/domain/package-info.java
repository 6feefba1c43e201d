/**
 * Domain models shared by the coordination services.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.sessioncore.domain.QueueEntry} - a session's bucket and fractional
 *       order key in the priority queue, with its strict total order</li>
 *   <li>{@link com.phillippitts.sessioncore.domain.PriorityLevel} - named priority buckets</li>
 *   <li>{@link com.phillippitts.sessioncore.domain.SessionWindow} - opaque window handle supplied
 *       by the presentation layer</li>
 *   <li>{@link com.phillippitts.sessioncore.domain.WindowClaim} - a session displayed in a window</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.sessioncore.domain;
