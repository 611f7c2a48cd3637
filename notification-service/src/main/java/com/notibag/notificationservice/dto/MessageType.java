package com.notibag.notificationservice.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * Frame types of the WebSocket protocol.
 */
public enum MessageType {
    // client -> server
    GET_NOTIFICATIONS("get_notifications"),
    MARK_READ("mark_read"),
    CLEAR_ALL("clear_all"),

    // server -> client
    NOTIFICATION("notification"),
    NOTIFICATIONS_LIST("notifications_list");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
