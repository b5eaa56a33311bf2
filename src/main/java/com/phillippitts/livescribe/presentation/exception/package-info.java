/**
 * Global exception handling for REST responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.livescribe.exception.SessionNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.livescribe.exception.SessionAccessDeniedException} → 403 Forbidden</li>
 *   <li>{@link com.phillippitts.livescribe.exception.InvalidTokenException} → 401 Unauthorized</li>
 *   <li>{@link com.phillippitts.livescribe.exception.UpstreamException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "SessionNotFoundException",
 *   "message": "Session not found",
 *   "details": "No live session with id m-42",
 *   "timestamp": "2026-03-02T10:15:04.118Z"
 * }
 * </pre>
 */
package com.phillippitts.livescribe.presentation.exception;
