package com.projectgroup5.arena.net;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 在线客户端登记表（连接 → 玩家 id）
 *
 * 所有读写都在同一把锁里完成；广播时先在锁内复制一份列表，
 * 释放锁之后再做网络写，避免持锁做 I/O。
 */
@Component
public class ClientRegistry {

    private final Object lock = new Object();

    // connection -> playerId
    private final Map<ClientConnection, String> clients = new LinkedHashMap<>();

    private final AtomicLong playerSequence = new AtomicLong();

    /** 服务器分配的玩家 id，进程内单调递增、不复用 */
    public String nextPlayerId() {
        return "player_" + playerSequence.incrementAndGet();
    }

    public void register(ClientConnection connection, String playerId) {
        synchronized (lock) {
            clients.put(connection, playerId);
        }
    }

    /** 幂等删除：只有第一次调用返回 true */
    public boolean unregister(ClientConnection connection) {
        synchronized (lock) {
            if (!clients.containsKey(connection)) {
                return false;
            }
            clients.remove(connection);
            return true;
        }
    }

    public List<ClientConnection> snapshotConnections() {
        synchronized (lock) {
            return new ArrayList<>(clients.keySet());
        }
    }

    public Optional<String> playerIdOf(ClientConnection connection) {
        synchronized (lock) {
            return Optional.ofNullable(clients.get(connection));
        }
    }

    public boolean isRegistered(ClientConnection connection) {
        synchronized (lock) {
            return clients.containsKey(connection);
        }
    }

    public int size() {
        synchronized (lock) {
            return clients.size();
        }
    }
}
