package com.projectgroup5.arena.game;

import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.dto.AmmoBoxSnapshot;
import com.projectgroup5.arena.dto.BulletSnapshot;
import com.projectgroup5.arena.dto.GameSnapshot;
import com.projectgroup5.arena.dto.PlayerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * 游戏世界状态（服务器权威）
 *
 * 只允许 tick 线程读写；其他线程只能拿 {@link #snapshot()} 产生的不可变快照。
 * 所有 map 都按插入顺序遍历：玩家按加入顺序，子弹按发射顺序。
 */
public class GameWorld {
    private static final Logger logger = LoggerFactory.getLogger(GameWorld.class);

    private final ArenaProperties properties;
    private final Clock clock;
    private final Random random;

    private long currentFrameNumber = 0;

    // 玩家状态
    private final Map<String, PlayerEntity> players = new LinkedHashMap<>();

    // 游戏实体
    private final Map<String, BulletEntity> bullets = new LinkedHashMap<>();
    private final Map<String, AmmoBoxEntity> ammoBoxes = new LinkedHashMap<>();

    // id 计数器，只增不减
    private long bulletCounter = 0;
    private long ammoBoxCounter = 0;

    // 弹药箱生成计时（毫秒）
    private long lastAmmoSpawnTime;
    private long ammoSpawnIntervalMillis;

    public GameWorld(ArenaProperties properties, Clock clock, Random random) {
        this.properties = properties;
        this.clock = clock;
        this.random = random;
        this.lastAmmoSpawnTime = clock.millis();
        this.ammoSpawnIntervalMillis = rollAmmoSpawnInterval();
    }

    /**
     * 新玩家：随机出生点，满弹药。
     * 重复 id 不报错，直接返回已有玩家。
     */
    public PlayerEntity addPlayer(String playerId) {
        PlayerEntity existing = players.get(playerId);
        if (existing != null) {
            logger.debug("Player {} already exists, ignoring duplicate join", playerId);
            return existing;
        }

        double r = properties.getPlayer().getRadius();
        PlayerEntity player = new PlayerEntity(
                playerId,
                randomCoordinate(r, properties.getWidth()),
                randomCoordinate(r, properties.getHeight()),
                properties.getPlayer().getMaxAmmo()
        );
        players.put(playerId, player);
        return player;
    }

    /** 移除玩家以及他还在飞的子弹；不存在时什么也不做 */
    public Optional<PlayerEntity> removePlayer(String playerId) {
        PlayerEntity removed = players.remove(playerId);
        if (removed == null) {
            return Optional.empty();
        }
        bullets.values().removeIf(b -> b.owner.equals(playerId));
        return Optional.of(removed);
    }

    /**
     * 发射子弹。以下情况不产生子弹、也不改变任何状态：
     * 玩家不存在 / 已死亡 / 没有弹药 / 方向向量长度为 0
     */
    public Optional<BulletEntity> createBullet(String ownerId, double dirX, double dirY) {
        PlayerEntity player = players.get(ownerId);
        if (player == null || !player.alive || player.ammo <= 0) {
            return Optional.empty();
        }

        double length = Math.sqrt(dirX * dirX + dirY * dirY);
        if (length == 0 || Double.isNaN(length) || Double.isInfinite(length)) {
            return Optional.empty();
        }
        double dx = dirX / length;
        double dy = dirY / length;

        // 出生点放在玩家外侧，避免刚发射就和自己重叠
        double offset = properties.getPlayer().getRadius() + properties.getBullet().getRadius();
        double speed = properties.getBullet().getSpeed();

        String bulletId = ownerId + "_" + bulletCounter++;
        BulletEntity bullet = new BulletEntity(
                bulletId,
                ownerId,
                player.x + dx * offset,
                player.y + dy * offset,
                dx * speed,
                dy * speed,
                clock.millis()
        );
        player.ammo -= 1;
        bullets.put(bulletId, bullet);
        return Optional.of(bullet);
    }

    /** 在随机位置放一个弹药箱，并重新抽取下一次的生成间隔 */
    public AmmoBoxEntity spawnAmmoBox() {
        double r = properties.getAmmoBox().getRadius();
        long now = clock.millis();
        AmmoBoxEntity box = new AmmoBoxEntity(
                "ammo_" + ammoBoxCounter++,
                randomCoordinate(r, properties.getWidth()),
                randomCoordinate(r, properties.getHeight()),
                now
        );
        ammoBoxes.put(box.id, box);

        lastAmmoSpawnTime = now;
        ammoSpawnIntervalMillis = rollAmmoSpawnInterval();
        return box;
    }

    /** 重生：新的随机位置 + 满弹药 */
    public void respawnPlayer(PlayerEntity player) {
        double r = properties.getPlayer().getRadius();
        player.respawn(
                randomCoordinate(r, properties.getWidth()),
                randomCoordinate(r, properties.getHeight()),
                properties.getPlayer().getMaxAmmo()
        );
    }

    public boolean isAmmoSpawnDue(long now) {
        return now - lastAmmoSpawnTime > ammoSpawnIntervalMillis;
    }

    /** 当前帧结束时的不可变快照 */
    public GameSnapshot snapshot() {
        Map<String, PlayerSnapshot> playerViews = new LinkedHashMap<>();
        players.forEach((id, p) -> playerViews.put(id, new PlayerSnapshot(
                id, p.x, p.y, p.velocityX, p.velocityY, p.score, p.alive, p.color, p.ammo)));

        Map<String, BulletSnapshot> bulletViews = new LinkedHashMap<>();
        bullets.forEach((id, b) -> bulletViews.put(id, new BulletSnapshot(
                id, b.owner, b.x, b.y, b.velocityX, b.velocityY)));

        Map<String, AmmoBoxSnapshot> boxViews = new LinkedHashMap<>();
        ammoBoxes.forEach((id, a) -> boxViews.put(id, new AmmoBoxSnapshot(id, a.x, a.y)));

        return new GameSnapshot(currentFrameNumber, playerViews, bulletViews, boxViews,
                clock.millis() / 1000.0);
    }

    private double randomCoordinate(double radius, double dimension) {
        return radius + random.nextDouble() * (dimension - 2 * radius);
    }

    private long rollAmmoSpawnInterval() {
        double min = properties.getAmmoBox().getSpawnIntervalMinSeconds();
        double max = properties.getAmmoBox().getSpawnIntervalMaxSeconds();
        double seconds = min + random.nextDouble() * Math.max(0, max - min);
        return Math.round(seconds * 1000);
    }

    // Getters
    public long now() {
        return clock.millis();
    }

    public ArenaProperties getProperties() {
        return properties;
    }

    public Map<String, PlayerEntity> getPlayers() {
        return players;
    }

    public Map<String, BulletEntity> getBullets() {
        return bullets;
    }

    public Map<String, AmmoBoxEntity> getAmmoBoxes() {
        return ammoBoxes;
    }

    public long getAmmoSpawnIntervalMillis() {
        return ammoSpawnIntervalMillis;
    }

    public long getLastAmmoSpawnTime() {
        return lastAmmoSpawnTime;
    }

    public long getCurrentFrameNumber() {
        return currentFrameNumber;
    }

    public void incrementFrame() {
        this.currentFrameNumber++;
    }
}
