package com.phillippitts.livescribe.service.gateway;

import com.phillippitts.livescribe.domain.Identity;

import java.util.Optional;

/**
 * One authenticated client transport connection.
 *
 * <p>A connection belongs to at most one room at a time. Implementations must make
 * {@link #send} safe to call from any thread and must never throw from it: a failed send is
 * logged and the event dropped for that connection only.
 */
public interface ClientConnection {

    String id();

    Identity identity();

    void send(OutboundEvent event);

    /**
     * @return session id of the room this connection is bound to
     */
    Optional<String> room();

    void bindRoom(String room);

    /**
     * Clears the binding if it still points at {@code room}.
     */
    void unbindRoom(String room);

    boolean isOpen();
}
