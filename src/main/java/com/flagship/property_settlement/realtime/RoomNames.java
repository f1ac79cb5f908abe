package com.flagship.property_settlement.realtime;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Room keys used for live pushes.
 */
public final class RoomNames {

    private static final Pattern ROOM_PATTERN = Pattern.compile("^(seller|buyer|agent)-[0-9a-fA-F-]{36}$");

    private RoomNames() {
    }

    public static String seller(UUID userId) {
        return "seller-" + userId;
    }

    public static String buyer(UUID userId) {
        return "buyer-" + userId;
    }

    public static String agent(UUID userId) {
        return "agent-" + userId;
    }

    public static boolean isValid(String room) {
        return room != null && ROOM_PATTERN.matcher(room).matches();
    }

    /**
     * The user a room belongs to.
     */
    public static UUID ownerOf(String room) {
        if (!isValid(room)) {
            throw new IllegalArgumentException("Invalid room: " + room);
        }
        return UUID.fromString(room.substring(room.indexOf('-') + 1));
    }
}
