package com.projectgroup5.arena.event;

public class PlayerRespawnedEvent extends GameEvent {

    private final String playerId;
    private final double x;
    private final double y;

    public PlayerRespawnedEvent(long timestamp, String playerId, double x, double y) {
        super(timestamp);
        this.playerId = playerId;
        this.x = x;
        this.y = y;
    }

    public String getPlayerId() { return playerId; }
    public double getX() { return x; }
    public double getY() { return y; }
}
