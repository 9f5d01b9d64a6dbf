package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName(StateMessage.TYPE)
public class StateMessage extends GameMessage {
    public static final String TYPE = "STATE";

    private GameSnapshot state;

    public StateMessage() {
    }

    public StateMessage(GameSnapshot state) {
        this.state = state;
    }

    @Override
    @JsonIgnore
    public boolean isServerOnly() {
        return true;
    }

    public GameSnapshot getState() { return state; }
    public void setState(GameSnapshot state) { this.state = state; }
}
