package io.sichter.gateway;

import java.util.ArrayDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolling 60 second window per client: a request is admitted while fewer than the limit were
 * admitted for that client in the preceding minute. A limit of zero disables limiting.
 */
final class RateLimiter {
    static final long WINDOW_MS = 60_000L;

    private final int limitPerMinute;
    private final ConcurrentMap<String, ArrayDeque<Long>> admitted = new ConcurrentHashMap<>();
    private final AtomicLong lastSweepMs = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    RateLimiter(int limitPerMinute) {
        this.limitPerMinute = Math.max(0, limitPerMinute);
    }

    boolean disabled() {
        return limitPerMinute <= 0;
    }

    boolean tryAcquire(String client, long nowMs) {
        if (disabled()) {
            return true;
        }
        boolean[] allowed = new boolean[1];
        admitted.compute(client, (k, stamps) -> {
            ArrayDeque<Long> window = stamps == null ? new ArrayDeque<>() : stamps;
            evictExpired(window, nowMs);
            if (window.size() < limitPerMinute) {
                window.addLast(nowMs);
                allowed[0] = true;
            }
            return window;
        });
        sweep(nowMs);
        if (!allowed[0]) {
            rejected.incrementAndGet();
        }
        return allowed[0];
    }

    long retryAfterSeconds(String client, long nowMs) {
        long[] waitMs = {1_000L};
        admitted.computeIfPresent(client, (k, window) -> {
            evictExpired(window, nowMs);
            Long oldest = window.peekFirst();
            if (oldest != null) {
                waitMs[0] = oldest + WINDOW_MS - nowMs;
            }
            return window.isEmpty() ? null : window;
        });
        return Math.max(1L, (waitMs[0] + 999L) / 1000L);
    }

    long rejectedTotal() {
        return rejected.get();
    }

    int trackedClients() {
        return admitted.size();
    }

    private void sweep(long nowMs) {
        long prev = lastSweepMs.get();
        if (nowMs - prev < WINDOW_MS || !lastSweepMs.compareAndSet(prev, nowMs)) {
            return;
        }
        for (String client : admitted.keySet()) {
            admitted.computeIfPresent(client, (k, window) -> {
                evictExpired(window, nowMs);
                return window.isEmpty() ? null : window;
            });
        }
    }

    private static void evictExpired(ArrayDeque<Long> window, long nowMs) {
        while (!window.isEmpty() && nowMs - window.peekFirst() >= WINDOW_MS) {
            window.pollFirst();
        }
    }
}
