package com.projectgroup5.arena.config;

import com.projectgroup5.arena.game.GameWorld;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

/**
 * 竞技场核心对象装配
 */
@Configuration
@EnableConfigurationProperties(ArenaProperties.class)
public class ArenaConfig {

    @Bean
    public Clock gameClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random gameRandom() {
        return new Random();
    }

    /** 唯一的服务器权威世界，只允许 tick 线程修改 */
    @Bean
    public GameWorld gameWorld(ArenaProperties properties, Clock gameClock, Random gameRandom) {
        return new GameWorld(properties, gameClock, gameRandom);
    }
}
