package com.tandem.protocol;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.annotation.Nullable;

/**
 * Frame sent by a client over the collaboration socket.
 * Identity is taken from the connection, never from the frame.
 */
@Serdeable
public record ClientMessage(
    String type,
    @Nullable Domain domain,
    @Nullable String resourceId,
    @Nullable Integer line,
    @Nullable Integer column,
    @Nullable Integer position,
    @Nullable Integer selectionStart,
    @Nullable Integer selectionEnd,
    @Nullable String content,
    @Nullable Integer cursorPosition
) {

    public ClientAction action() {
        return ClientAction.fromWire(type);
    }

    public Domain domainOrDefault() {
        return domain != null ? domain : Domain.DOCUMENT;
    }

    public static ClientMessage join(Domain domain, String resourceId) {
        return simple(ClientAction.JOIN, domain, resourceId);
    }

    public static ClientMessage leave(Domain domain, String resourceId) {
        return simple(ClientAction.LEAVE, domain, resourceId);
    }

    public static ClientMessage heartbeat(Domain domain, String resourceId) {
        return simple(ClientAction.HEARTBEAT, domain, resourceId);
    }

    public static ClientMessage cursor(Domain domain, String resourceId, int line, int column, int position,
                                       @Nullable Integer selectionStart, @Nullable Integer selectionEnd) {
        return new ClientMessage(ClientAction.CURSOR.wireName(), domain, resourceId,
            line, column, position, selectionStart, selectionEnd, null, null);
    }

    public static ClientMessage content(Domain domain, String resourceId, String content, int cursorPosition) {
        return new ClientMessage(ClientAction.CONTENT.wireName(), domain, resourceId,
            null, null, null, null, null, content, cursorPosition);
    }

    private static ClientMessage simple(ClientAction action, Domain domain, String resourceId) {
        return new ClientMessage(action.wireName(), domain, resourceId,
            null, null, null, null, null, null, null);
    }
}
