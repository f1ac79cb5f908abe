package com.flagship.property_settlement.realtime;

import com.flagship.property_settlement.directory.CallerResolver;
import com.flagship.property_settlement.directory.DirectoryUser;
import com.flagship.property_settlement.exception.ForbiddenOperationException;
import com.flagship.property_settlement.exception.RequestValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.UUID;

/**
 * Server-Sent Events stream. Callers may only join rooms that belong to them;
 * admins may join any room.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class RealtimeController {

    static final long STREAM_TIMEOUT_MS = 30 * 60 * 1000L;

    private final ConnectionRegistry registry;
    private final CallerResolver callerResolver;

    @GetMapping(path = "/api/realtime/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam("rooms") List<String> rooms,
                             @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        DirectoryUser caller = callerResolver.resolve(userId);
        for (String room : rooms) {
            if (!RoomNames.isValid(room)) {
                throw new RequestValidationException("rooms", "Invalid room: " + room);
            }
            if (!caller.isAdmin() && !caller.getId().equals(RoomNames.ownerOf(room))) {
                throw new ForbiddenOperationException("Not allowed to join room " + room);
            }
        }

        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        RealtimeConnection connection = registry.addConnection(caller.getId(), emitter);
        UUID connectionId = connection.getId();
        emitter.onCompletion(() -> registry.removeConnection(connectionId));
        emitter.onTimeout(() -> registry.removeConnection(connectionId));
        emitter.onError(e -> registry.removeConnection(connectionId));

        rooms.forEach(room -> registry.join(connectionId, room));
        log.info("User {} subscribed to {}", caller.getId(), rooms);
        return emitter;
    }
}
