package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 线路上的一条消息，按 type 字段区分：
 * JOIN / JOIN_ACK / INPUT / STATE / LEAVE
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JoinMessage.class, name = JoinMessage.TYPE),
        @JsonSubTypes.Type(value = JoinAckMessage.class, name = JoinAckMessage.TYPE),
        @JsonSubTypes.Type(value = InputMessage.class, name = InputMessage.TYPE),
        @JsonSubTypes.Type(value = StateMessage.class, name = StateMessage.TYPE),
        @JsonSubTypes.Type(value = LeaveMessage.class, name = LeaveMessage.TYPE)
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class GameMessage {

    /** 只允许服务器发送的消息类型，客户端发来即视为协议错误 */
    @JsonIgnore
    public boolean isServerOnly() {
        return false;
    }
}
