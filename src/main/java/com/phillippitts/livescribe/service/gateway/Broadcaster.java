package com.phillippitts.livescribe.service.gateway;

/**
 * Room-scoped multicast of outbound events. A room is keyed by session id.
 *
 * <p>The session coordinator calls these methods while holding the session lock, so events for
 * one room are published in lock order.
 */
public interface Broadcaster {

    /**
     * Adds {@code connection} to {@code room}, leaving any room it was bound to before.
     */
    void join(String room, ClientConnection connection);

    /**
     * Removes {@code connection} from its current room, if any.
     */
    void leave(ClientConnection connection);

    /**
     * Sends {@code event} to every current member of {@code room}. No replay for later joiners.
     */
    void publish(String room, OutboundEvent event);

    /**
     * Removes the room and unbinds all of its members.
     */
    void dissolve(String room);

    boolean isMember(String room, String connectionId);

    int memberCount(String room);
}
