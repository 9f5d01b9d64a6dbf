package com.projectgroup5.arena.game;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * 输入缓冲：每个玩家只保留最新一条输入（last input wins）。
 *
 * 连接线程各自覆盖自己的 key，tick 线程每帧一次性取走并清空。
 * 两帧之间的中间输入会被丢弃，这是有意的合并：客户端发送频率本来就高于 tick 频率，
 * 移动是按帧请求的而不是增量，所以只需要最后一条。
 * 已知限制：一帧内多次点击射击只会算一次。
 */
@Component
public class InputAggregator {

    private final Object lock = new Object();

    // playerId -> latest input
    private final Map<String, PlayerInput> inputBuffer = new HashMap<>();

    public void submit(String playerId, PlayerInput input) {
        synchronized (lock) {
            inputBuffer.put(playerId, input);
        }
    }

    public void remove(String playerId) {
        synchronized (lock) {
            inputBuffer.remove(playerId);
        }
    }

    /** 原子地取走全部输入并清空缓冲 */
    public Map<String, PlayerInput> drain() {
        synchronized (lock) {
            Map<String, PlayerInput> drained = new HashMap<>(inputBuffer);
            inputBuffer.clear();
            return drained;
        }
    }

    public int size() {
        synchronized (lock) {
            return inputBuffer.size();
        }
    }
}
