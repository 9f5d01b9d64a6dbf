package com.projectgroup5.arena.event;

public class PlayerKilledEvent extends GameEvent {

    private final String victimId;
    private final String shooterId;
    private final String bulletId;
    private final int shooterScore;

    public PlayerKilledEvent(long timestamp, String victimId, String shooterId,
                             String bulletId, int shooterScore) {
        super(timestamp);
        this.victimId = victimId;
        this.shooterId = shooterId;
        this.bulletId = bulletId;
        this.shooterScore = shooterScore;
    }

    public String getVictimId() { return victimId; }
    public String getShooterId() { return shooterId; }
    public String getBulletId() { return bulletId; }

    /** 击杀后射手的分数；射手已离开时为 -1 */
    public int getShooterScore() { return shooterScore; }
}
