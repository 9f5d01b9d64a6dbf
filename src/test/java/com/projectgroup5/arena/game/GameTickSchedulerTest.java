package com.projectgroup5.arena.game;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.arena.MutableClock;
import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.dto.GameSnapshot;
import com.projectgroup5.arena.dto.PlayerSnapshot;
import com.projectgroup5.arena.event.EventBus;
import com.projectgroup5.arena.event.PlayerJoinedEvent;
import com.projectgroup5.arena.event.PlayerLeftEvent;
import com.projectgroup5.arena.net.ClientRegistry;
import com.projectgroup5.arena.net.StateBroadcaster;
import com.projectgroup5.arena.protocol.FrameCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class GameTickSchedulerTest {

    private final List<Object> events = new ArrayList<>();
    private InputAggregator inputAggregator;
    private GameWorld world;
    private GameTickScheduler scheduler;

    @BeforeEach
    void setUp() {
        ArenaProperties properties = new ArenaProperties();
        properties.getAmmoBox().setSpawnIntervalMinSeconds(1000);
        properties.getAmmoBox().setSpawnIntervalMaxSeconds(1000);

        EventBus eventBus = new EventBus(events::add);
        world = new GameWorld(properties, new MutableClock(), new Random(7));
        inputAggregator = new InputAggregator();
        StateBroadcaster broadcaster = new StateBroadcaster(new ClientRegistry(),
                new FrameCodec(new ObjectMapper(), FrameCodec.DEFAULT_MAX_FRAME_BYTES),
                FrameCodec.DEFAULT_MAX_STATE_FRAME_BYTES);
        scheduler = new GameTickScheduler(world, new PhysicsEngine(properties, eventBus),
                inputAggregator, broadcaster, eventBus, properties);
    }

    @Test
    void accumulatorRunsWholeTicksOnly() {
        double interval = scheduler.getTickInterval();

        assertThat(scheduler.advance(interval * 0.5)).isZero();
        assertThat(scheduler.advance(interval * 0.5)).isEqualTo(1);
        assertThat(scheduler.advance(interval * 2.5)).isEqualTo(2);
        assertThat(scheduler.getLatestSnapshot().getTick()).isEqualTo(3);
    }

    @Test
    void joinAndLeaveAreAppliedOnNextTick() {
        scheduler.requestJoin("player_1");
        assertThat(world.getPlayers()).isEmpty();

        GameSnapshot joined = scheduler.tick();
        assertThat(joined.getPlayers()).containsOnlyKeys("player_1");
        assertThat(events).hasAtLeastOneElementOfType(PlayerJoinedEvent.class);

        scheduler.requestLeave("player_1");
        GameSnapshot left = scheduler.tick();
        assertThat(left.getPlayers()).isEmpty();
        assertThat(left.getBullets()).isEmpty();
        assertThat(events).hasAtLeastOneElementOfType(PlayerLeftEvent.class);
    }

    @Test
    void leaveForUnknownPlayerIsNoOp() {
        scheduler.requestLeave("player_404");

        GameSnapshot snapshot = scheduler.tick();

        assertThat(snapshot.getPlayers()).isEmpty();
        assertThat(events).noneMatch(PlayerLeftEvent.class::isInstance);
    }

    @Test
    void playerWithoutInputStopsMoving() {
        scheduler.requestJoin("player_1");
        scheduler.tick();

        inputAggregator.submit("player_1", new PlayerInput(false, true, false, false, false, 0, 0));
        PlayerSnapshot moving = scheduler.tick().getPlayers().get("player_1");
        assertThat(moving.getVx()).isEqualTo(200.0);

        PlayerSnapshot idle = scheduler.tick().getPlayers().get("player_1");
        assertThat(idle.getVx()).isZero();
        assertThat(idle.getX()).isEqualTo(world.getPlayers().get("player_1").x);
    }

    @Test
    void firingInputSpawnsBulletAndCostsAmmo() {
        scheduler.requestJoin("player_1");
        scheduler.tick();
        world.getPlayers().get("player_1").y = 300;

        inputAggregator.submit("player_1", new PlayerInput(false, false, false, false, true, 0, 1));
        GameSnapshot snapshot = scheduler.tick();

        assertThat(snapshot.getBullets()).hasSize(1);
        assertThat(snapshot.getBullets().values().iterator().next().getOwnerId()).isEqualTo("player_1");
        assertThat(snapshot.getPlayers().get("player_1").getAmmo()).isEqualTo(9);
    }

    @Test
    void inputForUnknownPlayerIsDropped() {
        inputAggregator.submit("player_ghost", new PlayerInput(false, false, false, false, true, 1, 0));

        GameSnapshot snapshot = scheduler.tick();

        assertThat(snapshot.getBullets()).isEmpty();
        assertThat(inputAggregator.size()).isZero();
    }

    @Test
    void latestSnapshotTracksLastTick() {
        assertThat(scheduler.getLatestSnapshot()).isSameAs(GameSnapshot.EMPTY);

        GameSnapshot snapshot = scheduler.tick();

        assertThat(scheduler.getLatestSnapshot()).isSameAs(snapshot);
        assertThat(snapshot.getTick()).isEqualTo(1);
    }
}
