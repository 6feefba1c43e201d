/**
 * REST controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /coordination/status} - pending uploads, upload progress, window claims and
 *       queue order in one snapshot</li>
 *   <li>{@code GET /coordination/queue/{sessionId}} - one queue entry, 404 if not queued</li>
 * </ul>
 */
package com.phillippitts.sessioncore.presentation.controller;
