package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName(JoinMessage.TYPE)
public class JoinMessage extends GameMessage {
    public static final String TYPE = "JOIN";
}
