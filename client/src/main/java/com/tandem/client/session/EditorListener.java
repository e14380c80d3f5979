package com.tandem.client.session;

import com.tandem.protocol.LockHolder;
import com.tandem.protocol.PresenceUser;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * The editor behind an {@link EditorSession}. Content callbacks arrive while
 * the session is marked remote-origin, so edits they trigger are not echoed.
 */
public interface EditorListener {

    /** Replace the local buffer. */
    void replaceContent(String content);

    /** Insert streamed text at {@code position}. */
    void insertText(int position, String text);

    default void presenceChanged(List<PresenceUser> users) {
    }

    default void cursorMoved(PresenceUser user) {
    }

    default void typingChanged(String userId, boolean typing) {
    }

    default void lockChanged(@Nullable LockHolder holder) {
    }

    default void streamingChanged(@Nullable StreamingIndicator indicator) {
    }
}
