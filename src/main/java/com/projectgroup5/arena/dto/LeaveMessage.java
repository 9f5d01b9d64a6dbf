package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName(LeaveMessage.TYPE)
public class LeaveMessage extends GameMessage {
    public static final String TYPE = "LEAVE";
}
