package com.projectgroup5.arena.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一帧结束时的完整世界快照（不可变）
 * tick 线程生成后交给广播器 / 状态接口使用，不持有任何活动对象的引用
 */
public final class GameSnapshot {

    public static final GameSnapshot EMPTY =
            new GameSnapshot(0, Map.of(), Map.of(), Map.of(), 0.0);

    private final long tick;
    private final Map<String, PlayerSnapshot> players;
    private final Map<String, BulletSnapshot> bullets;
    private final Map<String, AmmoBoxSnapshot> ammoBoxes;
    private final double timestamp;

    @JsonCreator
    public GameSnapshot(@JsonProperty("tick") long tick,
                        @JsonProperty("players") Map<String, PlayerSnapshot> players,
                        @JsonProperty("bullets") Map<String, BulletSnapshot> bullets,
                        @JsonProperty("ammo_boxes") Map<String, AmmoBoxSnapshot> ammoBoxes,
                        @JsonProperty("timestamp") double timestamp) {
        this.tick = tick;
        this.players = freeze(players);
        this.bullets = freeze(bullets);
        this.ammoBoxes = freeze(ammoBoxes);
        this.timestamp = timestamp;
    }

    private static <V> Map<String, V> freeze(Map<String, V> source) {
        if (source == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public long getTick() { return tick; }
    public Map<String, PlayerSnapshot> getPlayers() { return players; }
    public Map<String, BulletSnapshot> getBullets() { return bullets; }

    @JsonProperty("ammo_boxes")
    public Map<String, AmmoBoxSnapshot> getAmmoBoxes() { return ammoBoxes; }

    /** epoch 秒（带小数） */
    public double getTimestamp() { return timestamp; }

    @JsonIgnore
    public boolean isEmpty() {
        return players.isEmpty() && bullets.isEmpty() && ammoBoxes.isEmpty();
    }
}
