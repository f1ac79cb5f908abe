package com.flagship.property_settlement.realtime;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One open event stream and the rooms it has joined.
 */
public final class RealtimeConnection {

    private final UUID id;
    private final UUID userId;
    private final SseEmitter emitter;
    private final Instant connectedAt;
    private final Set<String> rooms = ConcurrentHashMap.newKeySet();

    RealtimeConnection(UUID id, UUID userId, SseEmitter emitter, Instant connectedAt) {
        this.id = id;
        this.userId = userId;
        this.emitter = emitter;
        this.connectedAt = connectedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public SseEmitter getEmitter() {
        return emitter;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Set<String> getRooms() {
        return Collections.unmodifiableSet(rooms);
    }

    void addRoom(String room) {
        rooms.add(room);
    }
}
