package com.yerin.pipeline.infra;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracked set of fire-and-forget work (pipeline executions, callback deliveries).
 * <p>
 * Every submitted task stays registered until it finishes, so shutdown can wait for the
 * set to drain and then interrupt whatever is left instead of leaking threads.
 */
@Slf4j
@Component
public class BackgroundTasks {

    private final ExecutorService workers;
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private final Duration shutdownGrace;
    private volatile boolean closed = false;

    @Autowired
    public BackgroundTasks(@Value("${pipeline.shutdown-grace:30s}") Duration shutdownGrace) {
        this(shutdownGrace, Executors.newCachedThreadPool(namedThreads()));
    }

    BackgroundTasks(Duration shutdownGrace, ExecutorService workers) {
        this.shutdownGrace = shutdownGrace;
        this.workers = workers;
    }

    public CompletableFuture<Void> submit(String name, Runnable task) {
        if (closed) {
            throw new IllegalStateException("background tasks are shut down, rejected " + name);
        }
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> {
                try {
                    task.run();
                } catch (RuntimeException | Error e) {
                    log.error("[BackgroundTasks] task {} failed", name, e);
                    throw e;
                }
            }, workers);
        } catch (RejectedExecutionException e) {
            // shutdown won the race with the closed check above
            throw new IllegalStateException("background tasks are shut down, rejected " + name, e);
        }
        inFlight.add(future);
        future.whenComplete((ok, err) -> inFlight.remove(future));
        return future;
    }

    public int inFlight() {
        return inFlight.size();
    }

    /**
     * Waits until every task registered so far has finished, including tasks they submit
     * while draining.
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!inFlight.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return false;
            List<CompletableFuture<Void>> snapshot = List.copyOf(inFlight);
            try {
                CompletableFuture.allOf(snapshot.toArray(new CompletableFuture[0]))
                        .get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                // failures are already logged by the task wrapper
                log.debug("[BackgroundTasks] drained with failures: {}", e.getCause().toString());
            }
        }
        return true;
    }

    @PreDestroy
    public void shutdown() {
        log.info("[BackgroundTasks] shutting down, inFlight={}", inFlight.size());
        try {
            boolean drained = awaitIdle(shutdownGrace);
            closed = true;
            if (!drained) {
                log.warn("[BackgroundTasks] {} task(s) still running after {}, interrupting",
                        inFlight.size(), shutdownGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            closed = true;
            workers.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "pipeline-task-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
