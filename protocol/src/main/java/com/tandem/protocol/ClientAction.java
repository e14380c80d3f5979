package com.tandem.protocol;

import java.util.Arrays;

/** Client → server message types carried in {@link ClientMessage#type()}. */
public enum ClientAction {
    JOIN("join_document"),
    LEAVE("leave_document"),
    CURSOR("cursor_update"),
    CONTENT("content_change"),
    HEARTBEAT("presence_heartbeat");

    private final String wireName;

    ClientAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ClientAction fromWire(String value) {
        return Arrays.stream(values())
            .filter(a -> a.wireName.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown client message type: " + value));
    }
}
