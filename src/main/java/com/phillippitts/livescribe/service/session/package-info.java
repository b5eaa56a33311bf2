/**
 * Live session table and the session aggregate.
 *
 * <p>{@link com.phillippitts.livescribe.service.session.SessionRegistry} guarantees at most one
 * live {@link com.phillippitts.livescribe.service.session.Session} per id. A session owns its
 * recognition handle, transcript buffer and fragment pump; all of them are mutated only under
 * the session lock.
 *
 * @since 1.0
 */
package com.phillippitts.livescribe.service.session;
