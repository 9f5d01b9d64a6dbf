package com.projectgroup5.arena.game;

import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.dto.GameSnapshot;
import com.projectgroup5.arena.event.EventBus;
import com.projectgroup5.arena.event.PlayerJoinedEvent;
import com.projectgroup5.arena.event.PlayerLeftEvent;
import com.projectgroup5.arena.net.StateBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * 游戏主循环调度器 - 固定时间步长
 *
 * 数据流:
 * Client Input → InputAggregator → (每帧) Physics Tick →
 * Collision Detection → State Snapshot → StateBroadcaster → Clients
 *
 * 独占一个 tick 线程，GameWorld 只在这个线程上修改。
 * 连接线程的加入 / 离开请求先进队列，下一帧开始时按顺序应用。
 */
@Component
public class GameTickScheduler implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(GameTickScheduler.class);

    // 一次调度里追帧超过这个数就打 warn
    private static final int CATCH_UP_WARN_TICKS = 5;

    private final GameWorld world;
    private final PhysicsEngine physicsEngine;
    private final InputAggregator inputAggregator;
    private final StateBroadcaster broadcaster;
    private final EventBus eventBus;

    private final int tickRate;
    private final double tickInterval;

    // 加入 / 离开请求，FIFO
    private final Queue<Consumer<GameWorld>> pendingCommands = new ConcurrentLinkedQueue<>();

    private volatile GameSnapshot latestSnapshot = GameSnapshot.EMPTY;
    private volatile boolean running = false;
    private Thread tickThread;

    private double accumulator = 0;

    public GameTickScheduler(GameWorld world,
                             PhysicsEngine physicsEngine,
                             InputAggregator inputAggregator,
                             StateBroadcaster broadcaster,
                             EventBus eventBus,
                             ArenaProperties properties) {
        this.world = world;
        this.physicsEngine = physicsEngine;
        this.inputAggregator = inputAggregator;
        this.broadcaster = broadcaster;
        this.eventBus = eventBus;
        this.tickRate = properties.getTick().getRate();
        this.tickInterval = properties.getTick().getIntervalSeconds();
    }

    // ==================== 生命周期 ====================

    @Override
    public void start() {
        if (running) return;
        running = true;
        tickThread = new Thread(this::runLoop, "game-tick");
        tickThread.setDaemon(true);
        tickThread.start();
    }

    @Override
    public void stop() {
        running = false;
        if (tickThread != null) {
            tickThread.interrupt();
            try {
                tickThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** 比连接服务器先启动、后停止 */
    @Override
    public int getPhase() {
        return DEFAULT_PHASE - 2048;
    }

    private void runLoop() {
        logger.info("Game loop started at {} TPS", tickRate);

        long lastTime = System.nanoTime();
        while (running) {
            long currentTime = System.nanoTime();
            double frameTime = (currentTime - lastTime) / 1_000_000_000.0;
            lastTime = currentTime;

            advance(frameTime);

            // 避免空转
            try {
                Thread.sleep(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        logger.info("Game loop stopped after {} ticks", world.getCurrentFrameNumber());
    }

    // ==================== 主循环 ====================

    /**
     * 一次调度：累加经过的时间，够一个 tick 就跑一个 tick。
     * 落后时会连续跑多个 tick，模拟永远按固定步长推进。
     *
     * @return 本次实际执行的 tick 数
     */
    public int advance(double elapsedSeconds) {
        accumulator += elapsedSeconds;

        int ticks = 0;
        while (accumulator >= tickInterval) {
            try {
                tick();
            } catch (RuntimeException e) {
                logger.error("Error processing tick {}", world.getCurrentFrameNumber(), e);
            }
            accumulator -= tickInterval;
            ticks++;
        }

        if (ticks >= CATCH_UP_WARN_TICKS) {
            logger.warn("Game loop fell behind, ran {} ticks in one pass", ticks);
        }
        return ticks;
    }

    /**
     * 推进一帧：
     * 1) 应用加入 / 离开
     * 2) 取走输入，更新速度、处理射击
     * 3) 物理更新 + 碰撞
     * 4) 生成快照并广播
     */
    public GameSnapshot tick() {
        applyPendingCommands();
        applyInputs();

        physicsEngine.update(world, tickInterval);
        world.incrementFrame();

        GameSnapshot snapshot = world.snapshot();
        latestSnapshot = snapshot;
        broadcaster.broadcast(snapshot);
        return snapshot;
    }

    private void applyPendingCommands() {
        Consumer<GameWorld> command;
        while ((command = pendingCommands.poll()) != null) {
            command.accept(world);
        }
    }

    private void applyInputs() {
        Map<String, PlayerInput> inputs = inputAggregator.drain();

        // 没有输入的玩家按中性输入处理：速度归零、不射击
        for (PlayerEntity player : world.getPlayers().values()) {
            PlayerInput input = inputs.getOrDefault(player.id, PlayerInput.NEUTRAL);
            physicsEngine.applyPlayerInput(player, input);

            if (input.wantsToFire()) {
                world.createBullet(player.id, input.getFireDirX(), input.getFireDirY())
                        .ifPresent(b -> logger.debug("Player {} fired {}, ammo left {}",
                                player.id, b.id, player.ammo));
            }
        }

        if (inputs.size() > world.getPlayers().size()) {
            logger.debug("Dropped input for {} unknown player(s)",
                    inputs.keySet().stream().filter(id -> !world.getPlayers().containsKey(id)).count());
        }
    }

    // ==================== 连接线程调用 ====================

    /** 请求在下一帧创建玩家 */
    public void requestJoin(String playerId) {
        pendingCommands.add(w -> {
            PlayerEntity player = w.addPlayer(playerId);
            eventBus.publish(new PlayerJoinedEvent(w.now(), playerId, player.x, player.y));
        });
    }

    /** 请求在下一帧移除玩家；重复请求没有副作用 */
    public void requestLeave(String playerId) {
        pendingCommands.add(w -> w.removePlayer(playerId).ifPresent(player ->
                eventBus.publish(new PlayerLeftEvent(w.now(), playerId, player.score))));
    }

    /** 最近一帧的不可变快照，任何线程都可以读 */
    public GameSnapshot getLatestSnapshot() {
        return latestSnapshot;
    }

    public int getTickRate() {
        return tickRate;
    }

    public double getTickInterval() {
        return tickInterval;
    }
}
