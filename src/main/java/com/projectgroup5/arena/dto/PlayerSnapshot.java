package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 某一帧结束时的玩家状态（不可变）
 */
public final class PlayerSnapshot {

    private final String id;
    private final double x;
    private final double y;
    private final double vx;
    private final double vy;
    private final int score;
    private final boolean alive;
    private final int[] color;
    private final int ammo;

    @JsonCreator
    public PlayerSnapshot(@JsonProperty("id") String id,
                          @JsonProperty("x") double x,
                          @JsonProperty("y") double y,
                          @JsonProperty("vx") double vx,
                          @JsonProperty("vy") double vy,
                          @JsonProperty("score") int score,
                          @JsonProperty("alive") boolean alive,
                          @JsonProperty("color") int[] color,
                          @JsonProperty("ammo") int ammo) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.vx = vx;
        this.vy = vy;
        this.score = score;
        this.alive = alive;
        this.color = color == null ? new int[3] : color.clone();
        this.ammo = ammo;
    }

    public String getId() { return id; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getVx() { return vx; }
    public double getVy() { return vy; }
    public int getScore() { return score; }
    public boolean isAlive() { return alive; }
    public int[] getColor() { return color.clone(); }
    public int getAmmo() { return ammo; }
}
