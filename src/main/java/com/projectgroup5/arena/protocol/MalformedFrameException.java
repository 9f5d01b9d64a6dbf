package com.projectgroup5.arena.protocol;

import java.io.IOException;

/**
 * 帧格式错误：长度前缀非法或者消息体无法解析
 * 只影响当前连接，连接处理器收到后直接断开
 */
public class MalformedFrameException extends IOException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
