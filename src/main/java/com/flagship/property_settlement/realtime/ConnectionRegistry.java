package com.flagship.property_settlement.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connections and the rooms they listen on.
 *
 * A push to a room goes to every connection that joined it on this instance.
 * Pushes are best effort: a connection whose stream fails is dropped and the
 * push carries on with the rest.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final Map<UUID, RealtimeConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<UUID>> rooms = new ConcurrentHashMap<>();

    public RealtimeConnection addConnection(UUID userId, SseEmitter emitter) {
        RealtimeConnection connection = new RealtimeConnection(UUID.randomUUID(), userId, emitter, Instant.now());
        connections.put(connection.getId(), connection);
        log.debug("Connection {} opened for user {}", connection.getId(), userId);
        return connection;
    }

    public void removeConnection(UUID connectionId) {
        RealtimeConnection removed = connections.remove(connectionId);
        if (removed == null) {
            return;
        }
        for (String room : removed.getRooms()) {
            rooms.computeIfPresent(room, (key, members) -> {
                members.remove(connectionId);
                return members.isEmpty() ? null : members;
            });
        }
        log.debug("Connection {} closed for user {}", connectionId, removed.getUserId());
    }

    public Optional<RealtimeConnection> lookup(UUID connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public void join(UUID connectionId, String room) {
        RealtimeConnection connection = connections.get(connectionId);
        if (connection == null) {
            throw new IllegalStateException("Unknown connection: " + connectionId);
        }
        connection.addRoom(room);
        rooms.computeIfAbsent(room, key -> ConcurrentHashMap.newKeySet()).add(connectionId);
        log.debug("Connection {} joined room {}", connectionId, room);
    }

    /**
     * @return number of connections the event was written to
     */
    public int publishToRoom(String room, String eventName, Object payload) {
        Set<UUID> members = rooms.get(room);
        if (members == null || members.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (UUID connectionId : Set.copyOf(members)) {
            RealtimeConnection connection = connections.get(connectionId);
            if (connection == null) {
                continue;
            }
            try {
                connection.getEmitter().send(SseEmitter.event().name(eventName).data(payload));
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping connection {} after failed push to {}: {}", connectionId, room, e.getMessage());
                removeConnection(connectionId);
            }
        }
        return delivered;
    }

    public int connectionCount() {
        return connections.size();
    }

    public int roomSize(String room) {
        Set<UUID> members = rooms.get(room);
        return members == null ? 0 : members.size();
    }
}
