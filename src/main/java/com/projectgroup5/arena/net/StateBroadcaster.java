package com.projectgroup5.arena.net;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.dto.GameSnapshot;
import com.projectgroup5.arena.dto.StateMessage;
import com.projectgroup5.arena.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 把每帧快照广播给所有在线连接
 *
 * 快照只编码一次；每个连接只做一次非阻塞入队，写 socket 由连接自己的写线程完成，
 * 一个卡住的客户端不会拖慢 tick。入队失败的连接在整轮广播结束后统一断开。
 */
@Component
public class StateBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(StateBroadcaster.class);

    private final ClientRegistry registry;
    private final FrameCodec codec;
    private final int maxStateFrameBytes;

    @Autowired
    public StateBroadcaster(ClientRegistry registry, FrameCodec codec, ArenaProperties properties) {
        this(registry, codec, properties.getServer().getMaxStateFrameBytes());
    }

    public StateBroadcaster(ClientRegistry registry, FrameCodec codec, int maxStateFrameBytes) {
        this.registry = registry;
        this.codec = codec;
        this.maxStateFrameBytes = maxStateFrameBytes;
    }

    /**
     * @return 成功入队的连接数
     */
    public int broadcast(GameSnapshot snapshot) {
        byte[] frame;
        try {
            frame = codec.encode(new StateMessage(snapshot));
        } catch (JsonProcessingException e) {
            logger.error("Failed to encode game state for tick {}", snapshot.getTick(), e);
            return 0;
        }

        // 超过客户端读取上限的帧发出去只会让所有客户端断开
        int bodyBytes = frame.length - FrameCodec.HEADER_BYTES;
        if (bodyBytes > maxStateFrameBytes) {
            logger.error("State for tick {} is {} bytes (max {}), not broadcasting",
                    snapshot.getTick(), bodyBytes, maxStateFrameBytes);
            return 0;
        }

        List<ClientConnection> targets = registry.snapshotConnections();
        List<ClientConnection> dead = new ArrayList<>();
        int delivered = 0;

        for (ClientConnection connection : targets) {
            if (connection.enqueue(frame)) {
                delivered++;
            } else {
                dead.add(connection);
            }
        }

        for (ClientConnection connection : dead) {
            if (connection.isClosed()) {
                // 读线程已经在清理了
                logger.debug("Skipping client {} closed during broadcast", connection.getPlayerId());
                continue;
            }
            logger.warn("Dropping client {} ({}): cannot deliver state",
                    connection.getPlayerId(), connection.getRemoteAddress());
            connection.close("outbound queue full or closed");
        }
        return delivered;
    }
}
