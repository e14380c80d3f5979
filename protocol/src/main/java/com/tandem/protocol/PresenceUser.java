package com.tandem.protocol;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

@Serdeable
@Schema(description = "A user or agent currently joined to a resource")
public record PresenceUser(
    String userId,
    String username,
    String color,
    boolean agent,
    @Nullable String agentName,
    @Nullable Integer cursorPosition,
    @Nullable Integer cursorLine,
    @Nullable Integer cursorColumn,
    @Nullable Integer selectionStart,
    @Nullable Integer selectionEnd,
    boolean typing
) {

    public PresenceUser withTyping(boolean typing) {
        return new PresenceUser(userId, username, color, agent, agentName, cursorPosition,
            cursorLine, cursorColumn, selectionStart, selectionEnd, typing);
    }

    public PresenceUser withCursor(@Nullable Integer position, @Nullable Integer line, @Nullable Integer column,
                                   @Nullable Integer selStart, @Nullable Integer selEnd) {
        return new PresenceUser(userId, username, color, agent, agentName, position,
            line, column, selStart, selEnd, typing);
    }
}
