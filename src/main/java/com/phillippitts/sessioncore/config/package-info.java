/**
 * Spring configuration: thread pools, default collaborators and pool metrics.
 *
 * <p>Externalized settings live in {@code config.properties}; the HTTP logging context filter in
 * {@code config.logging}.
 *
 * @see com.phillippitts.sessioncore.config.ThreadPoolConfig
 * @see com.phillippitts.sessioncore.config.CoordinationConfig
 * @since 1.0
 */
package com.phillippitts.sessioncore.config;
