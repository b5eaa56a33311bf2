/**
 * Deepgram live recognition client.
 *
 * <p>Connects to {@code wss://api.deepgram.com/v1/listen} through Spring's WebSocket client,
 * parses provider JSON with org.json and classifies failures into
 * {@link com.phillippitts.livescribe.exception.UpstreamErrorKind}.
 */
package com.phillippitts.livescribe.service.recognition.deepgram;
