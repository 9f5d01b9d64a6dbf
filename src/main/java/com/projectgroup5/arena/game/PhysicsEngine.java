package com.projectgroup5.arena.game;

import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.event.AmmoCollectedEvent;
import com.projectgroup5.arena.event.EventBus;
import com.projectgroup5.arena.event.PlayerKilledEvent;
import com.projectgroup5.arena.event.PlayerRespawnedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Iterator;

/**
 * 物理引擎 - 处理移动、过期、生成和碰撞（服务器权威）
 * 只由 tick 线程调用
 */
@Component
public class PhysicsEngine {
    private static final Logger logger = LoggerFactory.getLogger(PhysicsEngine.class);

    private final ArenaProperties properties;
    private final EventBus eventBus;

    public PhysicsEngine(ArenaProperties properties, EventBus eventBus) {
        this.properties = properties;
        this.eventBus = eventBus;
    }

    /**
     * 应用玩家输入到速度
     */
    public void applyPlayerInput(PlayerEntity player, PlayerInput input) {
        // 死亡的玩家不接受移动输入
        if (!player.alive) {
            player.velocityX = 0;
            player.velocityY = 0;
            return;
        }

        double vx = 0, vy = 0;

        if (input.isMoveUp()) vy -= 1;
        if (input.isMoveDown()) vy += 1;
        if (input.isMoveLeft()) vx -= 1;
        if (input.isMoveRight()) vx += 1;

        // 归一化对角线移动（避免斜向移动更快）
        double magnitude = Math.sqrt(vx * vx + vy * vy);
        if (magnitude > 0) {
            double speed = properties.getPlayer().getSpeed();
            vx = (vx / magnitude) * speed;
            vy = (vy / magnitude) * speed;
        }

        player.velocityX = vx;
        player.velocityY = vy;
    }

    /**
     * 推进一帧（固定时间步长），顺序固定：
     * 玩家 → 子弹 → 弹药箱 → 碰撞
     */
    public void update(GameWorld world, double deltaSeconds) {
        long now = world.now();
        updatePlayers(world, deltaSeconds, now);
        updateBullets(world, deltaSeconds, now);
        updateAmmoBoxes(world, now);
        detectCollisions(world, now);
    }

    private void updatePlayers(GameWorld world, double deltaSeconds, long now) {
        double r = properties.getPlayer().getRadius();
        double maxX = properties.getWidth() - r;
        double maxY = properties.getHeight() - r;

        for (PlayerEntity player : world.getPlayers().values()) {
            if (player.alive) {
                player.x += player.velocityX * deltaSeconds;
                player.y += player.velocityY * deltaSeconds;

                // 边界限制
                player.x = Math.max(r, Math.min(maxX, player.x));
                player.y = Math.max(r, Math.min(maxY, player.y));
            } else if (player.isRespawnDue(now)) {
                world.respawnPlayer(player);
                eventBus.publish(new PlayerRespawnedEvent(now, player.id, player.x, player.y));
            }
        }
    }

    private void updateBullets(GameWorld world, double deltaSeconds, long now) {
        long lifetimeMillis = seconds(properties.getBullet().getLifetimeSeconds());
        world.getBullets().values().removeIf(bullet -> {
            bullet.move(deltaSeconds);
            // 超时或飞出场地都算过期
            return bullet.isExpired(now, lifetimeMillis, properties.getWidth(), properties.getHeight());
        });
    }

    private void updateAmmoBoxes(GameWorld world, long now) {
        long lifetimeMillis = seconds(properties.getAmmoBox().getLifetimeSeconds());
        world.getAmmoBoxes().values().removeIf(box -> box.isExpired(now, lifetimeMillis));

        // 每帧最多检查一次、最多生成一个
        if (world.isAmmoSpawnDue(now)) {
            AmmoBoxEntity box = world.spawnAmmoBox();
            logger.debug("Spawned {} at ({}, {}), next in {}ms, total={}",
                    box.id, Math.round(box.x), Math.round(box.y),
                    world.getAmmoSpawnIntervalMillis(), world.getAmmoBoxes().size());
        }
    }

    /**
     * 碰撞检测：
     * 1) 子弹 vs 玩家：每颗子弹最多命中一个玩家，按玩家加入顺序取第一个
     * 2) 弹药箱 vs 玩家：第一个碰到的存活玩家补满弹药
     */
    public void detectCollisions(GameWorld world, long now) {
        double playerRadius = properties.getPlayer().getRadius();
        double bulletRadius = properties.getBullet().getRadius();
        long respawnMillis = seconds(properties.getPlayer().getRespawnSeconds());

        Iterator<BulletEntity> bullets = world.getBullets().values().iterator();
        while (bullets.hasNext()) {
            BulletEntity bullet = bullets.next();
            for (PlayerEntity player : world.getPlayers().values()) {
                if (!player.alive) continue;
                if (player.id.equals(bullet.owner)) continue; // 不能打到自己

                if (checkCircleCollision(
                        bullet.x, bullet.y, bulletRadius,
                        player.x, player.y, playerRadius)) {

                    player.kill(now + respawnMillis);

                    // 击杀者加分（射手可能已经离开）
                    int shooterScore = -1;
                    PlayerEntity shooter = world.getPlayers().get(bullet.owner);
                    if (shooter != null) {
                        shooter.score += 1;
                        shooterScore = shooter.score;
                    }
                    eventBus.publish(new PlayerKilledEvent(now, player.id, bullet.owner, bullet.id, shooterScore));

                    bullets.remove();
                    break;
                }
            }
        }

        double boxRadius = properties.getAmmoBox().getRadius();
        int maxAmmo = properties.getPlayer().getMaxAmmo();
        world.getAmmoBoxes().values().removeIf(box -> {
            for (PlayerEntity player : world.getPlayers().values()) {
                if (!player.alive) continue;

                if (checkCircleCollision(
                        box.x, box.y, boxRadius,
                        player.x, player.y, playerRadius)) {
                    player.ammo = maxAmmo;
                    eventBus.publish(new AmmoCollectedEvent(now, player.id, box.id));
                    return true;
                }
            }
            return false;
        });
    }

    /**
     * 圆形碰撞检测（严格小于：刚好相切不算命中）
     */
    public static boolean checkCircleCollision(double x1, double y1, double r1,
                                               double x2, double y2, double r2) {
        double dx = x1 - x2;
        double dy = y1 - y2;
        double distance = Math.sqrt(dx * dx + dy * dy);
        return distance < (r1 + r2);
    }

    private static long seconds(double seconds) {
        return Math.round(seconds * 1000);
    }
}
