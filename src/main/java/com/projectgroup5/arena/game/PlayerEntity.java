package com.projectgroup5.arena.game;

/**
 * 玩家实体（服务器权威）
 * 只由 tick 线程读写，对外一律通过快照暴露
 */
public class PlayerEntity {
    public final String id;
    public final int[] color;
    public double x, y;
    public double velocityX, velocityY;
    public int score;
    public int ammo;
    public boolean alive;
    public long respawnAt = 0; // epoch millis，死亡后有效

    public PlayerEntity(String id, double x, double y, int ammo) {
        this.id = id;
        this.color = PlayerColors.forId(id);
        this.x = x;
        this.y = y;
        this.ammo = ammo;
        this.score = 0;
        this.alive = true;
        this.velocityX = 0;
        this.velocityY = 0;
    }

    public void kill(long respawnAt) {
        this.alive = false;
        this.velocityX = 0;
        this.velocityY = 0;
        this.respawnAt = respawnAt;
    }

    public boolean isRespawnDue(long now) {
        return !alive && now >= respawnAt;
    }

    public void respawn(double x, double y, int ammo) {
        this.x = x;
        this.y = y;
        this.ammo = ammo;
        this.alive = true;
        this.velocityX = 0;
        this.velocityY = 0;
    }
}
