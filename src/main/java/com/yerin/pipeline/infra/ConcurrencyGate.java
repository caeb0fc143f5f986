package com.yerin.pipeline.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide admission gate bounding how many pipeline executions run at once.
 * Waiters are admitted in arrival order.
 */
@Slf4j
@Component
public class ConcurrencyGate {

    private final Semaphore sem;
    private final int maxConcurrency;

    public ConcurrencyGate(@Value("${pipeline.max-concurrency:4}") int maxConcurrency) {
        this.maxConcurrency = Math.max(1, maxConcurrency);
        this.sem = new Semaphore(this.maxConcurrency, true);
    }

    /**
     * Blocks until a slot is free. Use with try-with-resources so the slot is released on
     * every path.
     */
    public Permit acquire() throws InterruptedException {
        sem.acquire();
        return new Permit();
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public int inFlight() {
        return maxConcurrency - sem.availablePermits();
    }

    public int queueLength() {
        return sem.getQueueLength();
    }

    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {}

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                sem.release();
            } else {
                log.warn("[Gate] permit released twice, ignoring");
            }
        }
    }
}
