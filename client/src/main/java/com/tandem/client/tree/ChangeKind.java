package com.tandem.client.tree;

public enum ChangeKind {
    CREATED,
    MOVED_OR_RENAMED,
    CONTENT_UPDATED,
    DELETED
}
