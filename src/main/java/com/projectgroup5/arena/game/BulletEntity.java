package com.projectgroup5.arena.game;

/**
 * 子弹实体，速度大小固定为配置的子弹速度
 */
public class BulletEntity {
    public final String id;
    public final String owner;
    public double x, y;
    public final double velocityX, velocityY;
    public final long spawnTime;

    public BulletEntity(String id, String owner, double x, double y,
                        double velocityX, double velocityY, long spawnTime) {
        this.id = id;
        this.owner = owner;
        this.x = x;
        this.y = y;
        this.velocityX = velocityX;
        this.velocityY = velocityY;
        this.spawnTime = spawnTime;
    }

    public void move(double deltaSeconds) {
        x += velocityX * deltaSeconds;
        y += velocityY * deltaSeconds;
    }

    public boolean isExpired(long now, long lifetimeMillis, double worldWidth, double worldHeight) {
        return now - spawnTime > lifetimeMillis
                || x < 0 || x > worldWidth
                || y < 0 || y > worldHeight;
    }
}
