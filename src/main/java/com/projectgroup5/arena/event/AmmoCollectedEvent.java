package com.projectgroup5.arena.event;

public class AmmoCollectedEvent extends GameEvent {

    private final String playerId;
    private final String boxId;

    public AmmoCollectedEvent(long timestamp, String playerId, String boxId) {
        super(timestamp);
        this.playerId = playerId;
        this.boxId = boxId;
    }

    public String getPlayerId() { return playerId; }
    public String getBoxId() { return boxId; }
}
