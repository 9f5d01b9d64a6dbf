package com.projectgroup5.arena.event;

public abstract class GameEvent {

    private final long timestamp;

    protected GameEvent(long timestamp) {
        this.timestamp = timestamp;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
