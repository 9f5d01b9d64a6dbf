package com.projectgroup5.arena.game;

/**
 * 弹药箱：被任意存活玩家碰到即补满弹药
 */
public class AmmoBoxEntity {
    public final String id;
    public final double x, y;
    public final long spawnTime;

    public AmmoBoxEntity(String id, double x, double y, long spawnTime) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.spawnTime = spawnTime;
    }

    public boolean isExpired(long now, long lifetimeMillis) {
        return now - spawnTime > lifetimeMillis;
    }
}
