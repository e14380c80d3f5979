package com.tandem.protocol;

/**
 * Closed set of server → client event kinds.
 *
 * Domain-scoped kinds are broadcast to every connection and carry the domain
 * in their wire name ({@code task_lock_updated}). Resource-scoped kinds are
 * fanned out to the members of one resource room and carry the domain in the
 * message body instead.
 */
public enum EventKind {
    TREE_CHANGED("tree_changed", true),
    LOCK_UPDATED("lock_updated", true),
    CONTENT_UPDATED("content_updated", true),

    PRESENCE_UPDATED("presence_updated", false),
    PRESENCE_JOIN("presence:join", false),
    PRESENCE_LEAVE("presence:leave", false),
    CURSOR("presence:cursor", false),
    CONTENT_CHANGE("content:change", false),
    CONTENT_SYNC("content:sync", false),
    STREAM_START("stream:start", false),
    STREAM_CHUNK("stream:chunk", false),
    STREAM_END("stream:end", false),

    ERROR("error", false);

    private final String suffix;
    private final boolean domainScoped;

    EventKind(String suffix, boolean domainScoped) {
        this.suffix = suffix;
        this.domainScoped = domainScoped;
    }

    public String suffix() {
        return suffix;
    }

    public boolean domainScoped() {
        return domainScoped;
    }
}
