/**
 * Narrow interfaces to the surrounding meeting application and their implementations.
 *
 * <ul>
 *   <li>{@link com.phillippitts.livescribe.service.collaborator.IdentityVerifier} - token to
 *       identity ({@link com.phillippitts.livescribe.service.collaborator.JwtIdentityVerifier})</li>
 *   <li>{@link com.phillippitts.livescribe.service.collaborator.SessionOwnershipLookup} and
 *       {@link com.phillippitts.livescribe.service.collaborator.TranscriptPersistence} - meeting
 *       ownership and transcript storage
 *       ({@link com.phillippitts.livescribe.service.collaborator.MeetingApiClient})</li>
 * </ul>
 */
package com.phillippitts.livescribe.service.collaborator;
