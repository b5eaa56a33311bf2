package com.phillippitts.livescribe.service.coordinator;

import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.StreamOptions;
import com.phillippitts.livescribe.service.gateway.ClientConnection;

import java.util.Optional;

/**
 * Drives the lifecycle of live transcription sessions.
 *
 * <p>Every operation reports problems to the requesting connection as {@code stream:error} and
 * never throws for client mistakes. Failures of one session never affect another.
 *
 * <p><b>State machine:</b>
 * <pre>
 * IDLE → STARTING → ACTIVE → STOPPING → CLOSED
 * </pre>
 *
 * @since 1.0
 */
public interface SessionCoordinator {

    /**
     * Creates the session, opens its upstream stream and joins the requester to the room.
     * The requester must already be authorized to start {@code sessionId}.
     */
    void start(ClientConnection requester, String sessionId, StreamOptions options);

    /**
     * Forwards an audio chunk. Only the session owner may send audio.
     */
    void audio(ClientConnection requester, String sessionId, byte[] chunk);

    /**
     * Stops the session, drains in-flight fragments and persists the transcript. Only the session
     * owner may stop it; a repeated stop is harmless.
     */
    void stop(ClientConnection requester, String sessionId);

    /**
     * Adds an already-authorized observer to the room of an active session. No replay.
     */
    void join(ClientConnection requester, String sessionId);

    /**
     * Removes the connection from its room. Never affects the session itself.
     */
    void leave(ClientConnection connection);

    /**
     * Handles transport close: sessions started by {@code connection} are stopped, otherwise the
     * connection just leaves its room.
     */
    void connectionClosed(ClientConnection connection);

    Optional<SessionStatus> status(String sessionId);

    int activeSessionCount();

    /**
     * Stops every live session within the shutdown timeout. Later starts are rejected.
     */
    void shutdown();
}
