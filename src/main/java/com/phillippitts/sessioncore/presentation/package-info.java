/**
 * HTTP boundary of the coordination core: read-only diagnostics and exception mapping.
 *
 * <p>Presentation depends on services, never the other way round. Window toolkits that embed the
 * core talk to the services directly; this layer exists for operators.
 *
 * @see com.phillippitts.sessioncore.presentation.controller
 * @see com.phillippitts.sessioncore.presentation.exception
 */
package com.phillippitts.sessioncore.presentation;
