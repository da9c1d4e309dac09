package com.fastmqtt.support;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LogCaptureTest {

    @Test
    void readingWhileOtherThreadsLogIsSafe() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try (LogCapture capture = LogCapture.attach("test-capture-" + System.nanoTime())) {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> writers = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                writers.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2_000; i++) {
                        capture.logger().atInfo().addKeyValue("i", i).log("delivery");
                    }
                    return null;
                }));
            }

            start.countDown();
            int lastSeen = 0;
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (lastSeen < 8_000 && System.nanoTime() < deadline) {
                lastSeen = capture.events().size();
            }
            for (Future<?> w : writers) {
                w.get(10, TimeUnit.SECONDS);
            }

            assertThat(capture.events()).hasSize(8_000);
            assertThat(LogCapture.fields(capture.events().get(0))).containsKey("i");
        } finally {
            pool.shutdownNow();
        }
    }
}
