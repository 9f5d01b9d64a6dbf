package com.projectgroup5.arena.event;

public class PlayerLeftEvent extends GameEvent {

    private final String playerId;
    private final int finalScore;

    public PlayerLeftEvent(long timestamp, String playerId, int finalScore) {
        super(timestamp);
        this.playerId = playerId;
        this.finalScore = finalScore;
    }

    public String getPlayerId() { return playerId; }
    public int getFinalScore() { return finalScore; }
}
