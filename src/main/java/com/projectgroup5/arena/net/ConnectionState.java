package com.projectgroup5.arena.net;

/**
 * 连接状态机：ACCEPTED → AWAITING_JOIN → JOINED → CLOSED
 * 任何状态都可以直接进入 CLOSED
 */
public enum ConnectionState {
    ACCEPTED,
    AWAITING_JOIN,
    JOINED,
    CLOSED
}
