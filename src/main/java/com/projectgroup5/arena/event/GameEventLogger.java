package com.projectgroup5.arena.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 把游戏事件打到日志里（方便排查对局过程）
 */
@Component
public class GameEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(GameEventLogger.class);

    @EventListener
    public void onJoined(PlayerJoinedEvent event) {
        logger.info("Player {} spawned at ({}, {})",
                event.getPlayerId(), Math.round(event.getX()), Math.round(event.getY()));
    }

    @EventListener
    public void onLeft(PlayerLeftEvent event) {
        logger.info("Player {} left the arena, final score={}", event.getPlayerId(), event.getFinalScore());
    }

    @EventListener
    public void onKilled(PlayerKilledEvent event) {
        logger.info("Player {} eliminated by {} (bullet {}), shooter score={}",
                event.getVictimId(), event.getShooterId(), event.getBulletId(), event.getShooterScore());
    }

    @EventListener
    public void onRespawned(PlayerRespawnedEvent event) {
        logger.debug("Player {} respawned at ({}, {})",
                event.getPlayerId(), Math.round(event.getX()), Math.round(event.getY()));
    }

    @EventListener
    public void onAmmoCollected(AmmoCollectedEvent event) {
        logger.debug("Player {} collected {}", event.getPlayerId(), event.getBoxId());
    }
}
