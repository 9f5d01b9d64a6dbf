package com.projectgroup5.arena.event;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 游戏事件总线，基于 Spring 应用事件同步分发
 * 在 tick 线程上发布，监听器不能做阻塞操作
 */
@Component
public class EventBus {

    private final ApplicationEventPublisher publisher;

    public EventBus(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void publish(GameEvent event) {
        publisher.publishEvent(event);
    }
}
