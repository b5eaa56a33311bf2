/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.livescribe.exception.LiveScribeException}. They map one-to-one onto the
 * failure taxonomy of the session manager:
 * <ul>
 *   <li>{@link com.phillippitts.livescribe.exception.InvalidTokenException} - authentication
 *       failure; the connection is rejected at handshake</li>
 *   <li>{@link com.phillippitts.livescribe.exception.SessionAccessDeniedException} - caller is not
 *       the session owner</li>
 *   <li>{@link com.phillippitts.livescribe.exception.DuplicateSessionException} - {@code start} on
 *       a live session id</li>
 *   <li>{@link com.phillippitts.livescribe.exception.ProtocolMisuseException} - event not valid in
 *       the current state</li>
 *   <li>{@link com.phillippitts.livescribe.exception.UpstreamException} - recognition provider
 *       failure, categorized by {@link com.phillippitts.livescribe.exception.UpstreamErrorKind}</li>
 *   <li>{@link com.phillippitts.livescribe.exception.PersistenceException} - transcript could not
 *       be stored; logged, never blocks teardown</li>
 * </ul>
 *
 * <p>Clients never see exception messages. The gateway translates failures into stable
 * {@code stream:error} reasons and the REST layer into {@code ApiError} bodies.
 *
 * @since 1.0
 */
package com.phillippitts.livescribe.exception;
