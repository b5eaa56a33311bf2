package com.phillippitts.livescribe.service.gateway;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link Broadcaster} backed by the live connection table.
 *
 * <p>Rooms hold connection ids only; ids are resolved against the table at publish time, so a
 * connection that disconnected without leaving is skipped and pruned. Connection lifecycle is
 * owned by the transport, never by a room.
 *
 * @since 1.0
 */
@Component
public class RoomBroadcaster implements Broadcaster {

    private static final Logger LOG = LogManager.getLogger(RoomBroadcaster.class);

    private final ConcurrentMap<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> rooms = new ConcurrentHashMap<>();

    /**
     * Adds a connection to the live table.
     */
    public void register(ClientConnection connection) {
        Objects.requireNonNull(connection, "connection");
        connections.put(connection.id(), connection);
    }

    /**
     * Removes a connection from the live table and from its room.
     */
    public void unregister(ClientConnection connection) {
        if (connection == null) {
            return;
        }
        leave(connection);
        connections.remove(connection.id());
    }

    Optional<ClientConnection> connection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    int connectionCount() {
        return connections.size();
    }

    @Override
    public void join(String room, ClientConnection connection) {
        Objects.requireNonNull(room, "room");
        Objects.requireNonNull(connection, "connection");
        Optional<String> current = connection.room();
        if (current.isPresent() && !current.get().equals(room)) {
            leave(connection);
        }
        // membership changes stay inside compute; an empty set is removed atomically
        rooms.compute(room, (r, members) -> {
            Set<String> set = members != null ? members : ConcurrentHashMap.newKeySet();
            set.add(connection.id());
            return set;
        });
        connection.bindRoom(room);
        LOG.debug("Connection {} joined room {}", connection.id(), room);
    }

    @Override
    public void leave(ClientConnection connection) {
        connection.room().ifPresent(room -> {
            rooms.computeIfPresent(room, (r, members) -> {
                members.remove(connection.id());
                return members.isEmpty() ? null : members;
            });
            connection.unbindRoom(room);
            LOG.debug("Connection {} left room {}", connection.id(), room);
        });
    }

    @Override
    public void publish(String room, OutboundEvent event) {
        Set<String> members = rooms.get(room);
        if (members == null || members.isEmpty()) {
            return;
        }
        for (String id : members) {
            ClientConnection connection = connections.get(id);
            if (connection == null) {
                members.remove(id);
                continue;
            }
            connection.send(event);
        }
    }

    @Override
    public void dissolve(String room) {
        Set<String> members = rooms.remove(room);
        if (members == null) {
            return;
        }
        for (String id : members) {
            ClientConnection connection = connections.get(id);
            if (connection != null) {
                connection.unbindRoom(room);
            }
        }
        LOG.debug("Dissolved room {} ({} member(s))", room, members.size());
    }

    @Override
    public boolean isMember(String room, String connectionId) {
        Set<String> members = rooms.get(room);
        return members != null && members.contains(connectionId);
    }

    @Override
    public int memberCount(String room) {
        Set<String> members = rooms.get(room);
        return members == null ? 0 : members.size();
    }
}
