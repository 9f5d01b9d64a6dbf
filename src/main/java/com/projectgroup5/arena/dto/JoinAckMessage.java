package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName(JoinAckMessage.TYPE)
public class JoinAckMessage extends GameMessage {
    public static final String TYPE = "JOIN_ACK";

    @JsonProperty("player_id")
    private String playerId;
    private int[] color;

    public JoinAckMessage() {
    }

    public JoinAckMessage(String playerId, int[] color) {
        this.playerId = playerId;
        this.color = color;
    }

    @Override
    @JsonIgnore
    public boolean isServerOnly() {
        return true;
    }

    public String getPlayerId() { return playerId; }
    public void setPlayerId(String playerId) { this.playerId = playerId; }

    public int[] getColor() { return color; }
    public void setColor(int[] color) { this.color = color; }
}
