package com.delta.listingimport.ingest.external;

import com.delta.listingimport.ingest.error.UpstreamApiException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestDeduplicatorTest {
    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentCallsWithSameKeyShareOneExecution() throws Exception {
        RequestDeduplicator<String> deduplicator = new RequestDeduplicator<>();
        AtomicInteger executions = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        executor = Executors.newFixedThreadPool(4);

        Future<String> first = executor.submit(() -> deduplicator.execute("search:phoenix", () -> {
            executions.incrementAndGet();
            entered.countDown();
            await(release);
            return "result";
        }));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        List<Future<String>> followers = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            followers.add(executor.submit(() -> deduplicator.execute("search:phoenix", () -> {
                executions.incrementAndGet();
                return "duplicate";
            })));
        }
        waitForFollowersToQueue();
        assertThat(deduplicator.inFlightCount()).isEqualTo(1);
        release.countDown();

        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("result");
        for (Future<String> follower : followers) {
            assertThat(follower.get(5, TimeUnit.SECONDS)).isEqualTo("result");
        }
        assertThat(executions.get()).isEqualTo(1);
        assertThat(deduplicator.inFlightCount()).isZero();
    }

    @Test
    void failureIsSharedAndKeyIsReleased() throws Exception {
        RequestDeduplicator<String> deduplicator = new RequestDeduplicator<>();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        executor = Executors.newFixedThreadPool(2);

        Future<String> first = executor.submit(() -> deduplicator.execute("property:1", () -> {
            entered.countDown();
            await(release);
            throw new UpstreamApiException("gone", 404);
        }));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        Future<String> follower = executor.submit(() -> deduplicator.execute("property:1", () -> "unused"));
        waitForFollowersToQueue();
        release.countDown();

        assertThatThrownBy(() -> first.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(UpstreamApiException.class);
        assertThatThrownBy(() -> follower.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(UpstreamApiException.class);

        assertThat(deduplicator.execute("property:1", () -> "fresh")).isEqualTo("fresh");
    }

    @Test
    void differentKeysRunIndependently() {
        RequestDeduplicator<Integer> deduplicator = new RequestDeduplicator<>();

        assertThat(deduplicator.execute("a", () -> 1)).isEqualTo(1);
        assertThat(deduplicator.execute("b", () -> 2)).isEqualTo(2);
        assertThat(deduplicator.inFlightCount()).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void waitForFollowersToQueue() throws InterruptedException {
        Thread.sleep(100);
    }
}
