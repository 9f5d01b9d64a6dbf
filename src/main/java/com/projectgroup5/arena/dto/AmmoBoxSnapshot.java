package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class AmmoBoxSnapshot {

    private final String id;
    private final double x;
    private final double y;

    @JsonCreator
    public AmmoBoxSnapshot(@JsonProperty("id") String id,
                           @JsonProperty("x") double x,
                           @JsonProperty("y") double y) {
        this.id = id;
        this.x = x;
        this.y = y;
    }

    public String getId() { return id; }
    public double getX() { return x; }
    public double getY() { return y; }
}
