package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class BulletSnapshot {

    private final String id;
    private final String ownerId;
    private final double x;
    private final double y;
    private final double vx;
    private final double vy;

    @JsonCreator
    public BulletSnapshot(@JsonProperty("id") String id,
                          @JsonProperty("owner_id") String ownerId,
                          @JsonProperty("x") double x,
                          @JsonProperty("y") double y,
                          @JsonProperty("vx") double vx,
                          @JsonProperty("vy") double vy) {
        this.id = id;
        this.ownerId = ownerId;
        this.x = x;
        this.y = y;
        this.vx = vx;
        this.vy = vy;
    }

    public String getId() { return id; }

    @JsonProperty("owner_id")
    public String getOwnerId() { return ownerId; }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getVx() { return vx; }
    public double getVy() { return vy; }
}
