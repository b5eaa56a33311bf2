/**
 * Domain models for live transcription sessions.
 *
 * <p>All domain models are immutable records that validate themselves in their compact
 * constructors. They carry no transport or persistence concerns.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.livescribe.domain.TranscriptFragment} - one interim or final unit
 *       of recognizer output, ordered by {@code sequence}</li>
 *   <li>{@link com.phillippitts.livescribe.domain.SessionState} - session lifecycle states and
 *       the legal transitions between them</li>
 *   <li>{@link com.phillippitts.livescribe.domain.RecognitionConfig} - settings of one upstream
 *       recognition stream</li>
 *   <li>{@link com.phillippitts.livescribe.domain.Identity} - authenticated caller</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.livescribe.domain;
