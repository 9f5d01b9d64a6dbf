package com.projectgroup5.arena.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.dto.GameMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * 长度前缀帧编解码：
 * [4 字节大端无符号长度][长度字节的 UTF-8 JSON]
 *
 * 服务器连接处理器和客户端桩共用这一个实现。
 */
@Component
public class FrameCodec {

    public static final int HEADER_BYTES = 4;
    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024;
    // STATE 随世界规模增长，客户端读取时用这个上限
    public static final int DEFAULT_MAX_STATE_FRAME_BYTES = 8 * 1024 * 1024;

    private final ObjectMapper objectMapper;
    private final int maxFrameBytes;

    @Autowired
    public FrameCodec(ObjectMapper objectMapper, ArenaProperties properties) {
        this(objectMapper, properties.getServer().getMaxFrameBytes());
    }

    public FrameCodec(ObjectMapper objectMapper, int maxFrameBytes) {
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        this.maxFrameBytes = maxFrameBytes;
    }

    /** 同样的编码规则，只换读取上限（客户端读 STATE 时用更大的上限） */
    public FrameCodec withMaxFrameBytes(int maxFrameBytes) {
        return new FrameCodec(objectMapper, maxFrameBytes);
    }

    /** 编码成完整的一帧（含长度前缀） */
    public byte[] encode(GameMessage message) throws JsonProcessingException {
        byte[] body = objectMapper.writeValueAsBytes(message);
        return ByteBuffer.allocate(HEADER_BYTES + body.length)
                .putInt(body.length)
                .put(body)
                .array();
    }

    public void write(OutputStream out, GameMessage message) throws IOException {
        writeFrame(out, encode(message));
    }

    /** 写出已经编码好的帧，广播时同一帧发给所有连接 */
    public void writeFrame(OutputStream out, byte[] frame) throws IOException {
        out.write(frame);
        out.flush();
    }

    /**
     * 阻塞读取一帧。
     *
     * @return 流结束（包括读到一半被截断）时返回 empty
     * @throws MalformedFrameException 长度前缀非法或消息体无法解析
     */
    public Optional<GameMessage> read(InputStream in) throws IOException {
        byte[] header = readFully(in, HEADER_BYTES);
        if (header == null) {
            return Optional.empty();
        }

        long length = Integer.toUnsignedLong(ByteBuffer.wrap(header).getInt());
        if (length == 0 || length > maxFrameBytes) {
            throw new MalformedFrameException("Invalid frame length " + length
                    + " (max " + maxFrameBytes + ")");
        }

        byte[] body = readFully(in, (int) length);
        if (body == null) {
            return Optional.empty();
        }

        try {
            GameMessage message = objectMapper.readValue(body, GameMessage.class);
            if (message == null) {
                throw new MalformedFrameException("Frame body is JSON null");
            }
            return Optional.of(message);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Undecodable frame body: " + e.getOriginalMessage(), e);
        }
    }

    /** 从字节数组解码第一帧，数据不完整时返回 empty */
    public Optional<GameMessage> decode(byte[] bytes) throws MalformedFrameException {
        try {
            return read(new ByteArrayInputStream(bytes));
        } catch (MalformedFrameException e) {
            throw e;
        } catch (IOException e) {
            // ByteArrayInputStream 不会抛 IO 异常
            throw new IllegalStateException(e);
        }
    }

    /** 读满 n 个字节；在读满之前遇到流结束返回 null */
    private static byte[] readFully(InputStream in, int n) throws IOException {
        byte[] data = new byte[n];
        int offset = 0;
        while (offset < n) {
            int read;
            try {
                read = in.read(data, offset, n - offset);
            } catch (EOFException e) {
                return null;
            }
            if (read < 0) {
                return null;
            }
            offset += read;
        }
        return data;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }
}
