package com.openforge.mnemo.memory.model;

public enum Direction {
    OUTGOING,
    INCOMING,
    BOTH;

    public boolean followsOutgoing() {
        return this == OUTGOING || this == BOTH;
    }

    public boolean followsIncoming() {
        return this == INCOMING || this == BOTH;
    }
}
