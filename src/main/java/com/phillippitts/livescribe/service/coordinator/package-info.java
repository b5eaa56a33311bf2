/**
 * Session lifecycle coordination.
 *
 * <p>{@link com.phillippitts.livescribe.service.coordinator.DefaultSessionCoordinator} owns the
 * per-session state machine and guarantees exactly one upstream recognition stream per live
 * session despite concurrent client events, disconnects and provider failures.
 *
 * <p><b>Key guarantees:</b>
 * <ul>
 *   <li>Of two concurrent starts for one id exactly one succeeds</li>
 *   <li>Final fragments are buffered and broadcast in adapter order, without loss or duplication</li>
 *   <li>The persisted transcript is the single-space join of all final fragments</li>
 *   <li>Stop is idempotent; nothing is broadcast after {@code stream:stopped}</li>
 * </ul>
 *
 * <p>Lifecycle events live in the {@code event} subpackage.
 *
 * @since 1.0
 */
package com.phillippitts.livescribe.service.coordinator;
