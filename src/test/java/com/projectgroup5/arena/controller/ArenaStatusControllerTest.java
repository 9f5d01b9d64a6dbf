package com.projectgroup5.arena.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.projectgroup5.arena.MutableClock;
import com.projectgroup5.arena.config.ArenaProperties;
import com.projectgroup5.arena.event.EventBus;
import com.projectgroup5.arena.game.GameTickScheduler;
import com.projectgroup5.arena.game.GameWorld;
import com.projectgroup5.arena.game.InputAggregator;
import com.projectgroup5.arena.game.PhysicsEngine;
import com.projectgroup5.arena.net.ClientRegistry;
import com.projectgroup5.arena.net.StateBroadcaster;
import com.projectgroup5.arena.protocol.FrameCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Random;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ArenaStatusControllerTest {

    private GameTickScheduler scheduler;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ArenaProperties properties = new ArenaProperties();
        properties.getAmmoBox().setSpawnIntervalMinSeconds(1000);
        properties.getAmmoBox().setSpawnIntervalMaxSeconds(1000);
        EventBus eventBus = new EventBus(event -> { });
        ClientRegistry registry = new ClientRegistry();
        GameWorld world = new GameWorld(properties, new MutableClock(), new Random(1));
        scheduler = new GameTickScheduler(world, new PhysicsEngine(properties, eventBus), new InputAggregator(),
                new StateBroadcaster(registry, new FrameCodec(new ObjectMapper(), FrameCodec.DEFAULT_MAX_FRAME_BYTES),
                        FrameCodec.DEFAULT_MAX_STATE_FRAME_BYTES),
                eventBus, properties);
        mockMvc = MockMvcBuilders.standaloneSetup(new ArenaStatusController(scheduler, registry)).build();
    }

    @Test
    void statusBeforeFirstTick() throws Exception {
        mockMvc.perform(get("/api/arena/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tick").value(0))
                .andExpect(jsonPath("$.players").value(0))
                .andExpect(jsonPath("$.connections").value(0))
                .andExpect(jsonPath("$.tickRate").value(30));
    }

    @Test
    void statusReflectsLatestTick() throws Exception {
        scheduler.requestJoin("player_1");
        scheduler.requestJoin("player_2");
        scheduler.tick();

        mockMvc.perform(get("/api/arena/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tick").value(1))
                .andExpect(jsonPath("$.players").value(2))
                .andExpect(jsonPath("$.bullets").value(0));
    }

    @Test
    void snapshotUsesWireFieldNames() throws Exception {
        scheduler.requestJoin("player_1");
        scheduler.tick();

        mockMvc.perform(get("/api/arena/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tick").value(1))
                .andExpect(jsonPath("$.players.player_1.ammo").value(10))
                .andExpect(jsonPath("$.players.player_1.alive").value(true))
                .andExpect(jsonPath("$.players.player_1.color.length()").value(3))
                .andExpect(jsonPath("$.ammo_boxes").isMap())
                .andExpect(jsonPath("$.bullets").isEmpty());
    }
}
