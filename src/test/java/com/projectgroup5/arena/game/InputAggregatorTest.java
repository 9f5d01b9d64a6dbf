package com.projectgroup5.arena.game;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InputAggregatorTest {

    private final InputAggregator aggregator = new InputAggregator();

    @Test
    void lastInputWins() {
        PlayerInput first = new PlayerInput(true, false, false, false, false, 0, 0);
        PlayerInput second = new PlayerInput(false, true, false, false, true, 1, 0);

        aggregator.submit("player_1", first);
        aggregator.submit("player_1", second);

        assertThat(aggregator.drain()).containsExactlyEntriesOf(Map.of("player_1", second));
    }

    @Test
    void drainClearsBuffer() {
        aggregator.submit("player_1", PlayerInput.NEUTRAL);
        aggregator.submit("player_2", PlayerInput.NEUTRAL);

        assertThat(aggregator.drain()).hasSize(2);
        assertThat(aggregator.drain()).isEmpty();
        assertThat(aggregator.size()).isZero();
    }

    @Test
    void removeDropsOnlyThatPlayer() {
        aggregator.submit("player_1", PlayerInput.NEUTRAL);
        aggregator.submit("player_2", PlayerInput.NEUTRAL);

        aggregator.remove("player_1");
        aggregator.remove("player_3");

        assertThat(aggregator.drain()).containsOnlyKeys("player_2");
    }

    @Test
    void concurrentProducersNeverLoseTheirLatestRecord() throws Exception {
        int producers = 8;
        int perProducer = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        List<Map<String, PlayerInput>> drained = new ArrayList<>();

        for (int p = 0; p < producers; p++) {
            String id = "player_" + p;
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 1; i <= perProducer; i++) {
                    aggregator.submit(id, new PlayerInput(false, false, false, false, i == perProducer, i, 0));
                }
            });
        }

        start.countDown();
        pool.shutdown();
        while (!pool.awaitTermination(1, TimeUnit.MILLISECONDS)) {
            drained.add(aggregator.drain());
        }
        drained.add(aggregator.drain());

        for (int p = 0; p < producers; p++) {
            String id = "player_" + p;
            // 最后一次 drain 到该玩家的记录一定是他最后提交的那条
            PlayerInput last = null;
            for (Map<String, PlayerInput> batch : drained) {
                if (batch.containsKey(id)) {
                    PlayerInput input = batch.get(id);
                    if (last != null) {
                        assertThat(input.getFireDirX()).isGreaterThan(last.getFireDirX());
                    }
                    last = input;
                }
            }
            assertThat(last).isNotNull();
            assertThat(last.getFireDirX()).isEqualTo(perProducer);
            assertThat(last.isFire()).isTrue();
        }
    }
}
