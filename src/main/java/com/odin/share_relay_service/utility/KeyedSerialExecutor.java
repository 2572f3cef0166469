package com.odin.share_relay_service.utility;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs tasks one at a time per key, in submission order, on a shared executor.
 * Tasks of different keys never wait on each other.
 *
 * A failing task is logged and does not stop the tasks queued behind it.
 */
@Slf4j
public class KeyedSerialExecutor {

    private final Executor executor;
    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(String key, Runnable task) {
        Runnable guarded = CorrelationIdUtil.propagate(() -> runGuarded(key, task));
        CompletableFuture<Void> trigger = new CompletableFuture<>();
        CompletableFuture<Void> next = trigger.thenRunAsync(guarded, executor);

        CompletableFuture<Void> previous = tails.put(key, next);
        next.whenComplete((ignored, error) -> tails.remove(key, next));

        if (previous == null) {
            trigger.complete(null);
        } else {
            previous.whenComplete((ignored, error) -> trigger.complete(null));
        }
        return next;
    }

    /**
     * Number of keys with queued or running work.
     */
    public int activeKeys() {
        return tails.size();
    }

    private void runGuarded(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("[LANE] Task failed on lane={}: {}", key, e.getMessage(), e);
        }
    }
}
