/**
 * Client-facing surfaces: the transcription WebSocket endpoint, the status REST endpoints and
 * the REST error mapping.
 */
package com.phillippitts.livescribe.presentation;
