package com.yerin.pipeline.infra;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private Backoff() {}

    public static Duration expJitter(int retryCount, long baseMillis, double factor, long capMillis, double jitterRatio) {
        double exp = baseMillis * Math.pow(factor, Math.max(0, retryCount));
        long capped = (long) Math.min(exp, (double) capMillis);
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterRatio; // 1±r
        long withJitter = Math.max(0, (long)(capped * jitter));
        return Duration.ofMillis(withJitter);
    }

    /**
     * Jitter-free schedule: base, base*factor, base*factor^2, ... one entry per attempt.
     * Entry {@code i} is the wait after attempt {@code i + 1} fails.
     */
    public static List<Duration> schedule(Duration base, double factor, int attempts) {
        List<Duration> delays = new ArrayList<>(Math.max(0, attempts));
        for (int i = 0; i < attempts; i++) {
            delays.add(expJitter(i, base.toMillis(), factor, Long.MAX_VALUE, 0.0));
        }
        return List.copyOf(delays);
    }
}
