package com.tandem.protocol;

public enum NodeKind {
    FOLDER,
    LEAF
}
