/**
 * REST controllers.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code GET /ping} - liveness and MDC verification</li>
 *   <li>{@code GET /api/sessions} - number of live sessions</li>
 *   <li>{@code GET /api/sessions/{sessionId}} - state of one live session, 404 otherwise</li>
 * </ul>
 *
 * @see com.phillippitts.livescribe.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.livescribe.presentation.controller;
