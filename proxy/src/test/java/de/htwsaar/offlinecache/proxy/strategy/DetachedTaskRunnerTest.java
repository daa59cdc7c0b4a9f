package de.htwsaar.offlinecache.proxy.strategy;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class DetachedTaskRunnerTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final AtomicInteger failures = new AtomicInteger();
    private final DetachedTaskRunner runner = new DetachedTaskRunner(executor, failures::incrementAndGet);

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdownNow();
    }

    @Test
    void failedTask_completesNormallyAndIsCounted() throws Exception {
        CompletableFuture<Void> done = runner.spawnDetached(
                "failing", () -> CompletableFuture.failedFuture(new IOException("offline")));

        assertDoesNotThrow(() -> done.get(1, TimeUnit.SECONDS));
        assertEquals(1, failures.get());
    }

    @Test
    void throwingSupplier_isSwallowedAndCounted() throws Exception {
        CompletableFuture<Void> done = runner.spawnDetached("throwing", () -> {
            throw new IllegalStateException("boom");
        });

        done.get(1, TimeUnit.SECONDS);
        assertEquals(1, failures.get());
    }

    @Test
    void successfulTask_isNotCounted() throws Exception {
        runner.spawnDetached("ok", () -> CompletableFuture.completedFuture("fine")).get(1, TimeUnit.SECONDS);

        assertEquals(0, failures.get());
    }

    @Test
    void traceId_isCarriedToWorkerThread() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        MDC.put("traceId", "abc-123");

        runner.spawnDetached("trace", () -> {
                    seen.set(MDC.get("traceId"));
                    return CompletableFuture.completedFuture(null);
                })
                .get(1, TimeUnit.SECONDS);

        assertEquals("abc-123", seen.get());
    }

    @Test
    void rejectedExecution_isSwallowed() throws Exception {
        executor.shutdown();

        CompletableFuture<Void> done =
                runner.spawnDetached("rejected", () -> CompletableFuture.completedFuture(null));

        done.get(1, TimeUnit.SECONDS);
        assertEquals(1, failures.get());
    }
}
