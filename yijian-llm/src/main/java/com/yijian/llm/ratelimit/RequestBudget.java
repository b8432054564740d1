package com.yijian.llm.ratelimit;

import java.util.function.LongSupplier;

/**
 * Local cap on generation calls. Starts with {@code capacity} permits and earns one back every
 * {@code millisPerPermit}, never holding more than {@code capacity}.
 */
public class RequestBudget {

    private final int capacity;
    private final long millisPerPermit;
    private final LongSupplier clock;

    private long permits;
    private long lastEarnedAt;

    public RequestBudget(int capacity, long millisPerPermit) {
        this(capacity, millisPerPermit, System::currentTimeMillis);
    }

    RequestBudget(int capacity, long millisPerPermit, LongSupplier clock) {
        if (capacity < 1 || millisPerPermit < 1) {
            throw new IllegalArgumentException("Request budget needs a positive capacity and interval");
        }
        this.capacity = capacity;
        this.millisPerPermit = millisPerPermit;
        this.clock = clock;
        this.permits = capacity;
        this.lastEarnedAt = clock.getAsLong();
    }

    public static RequestBudget perMinute(int requestsPerMinute) {
        return new RequestBudget(requestsPerMinute, Math.max(1L, 60_000L / requestsPerMinute));
    }

    public synchronized boolean tryAcquire() {
        earn(clock.getAsLong());
        if (permits == 0) {
            return false;
        }
        permits--;
        return true;
    }

    public synchronized long millisUntilNextPermit() {
        long now = clock.getAsLong();
        earn(now);
        return permits > 0 ? 0 : Math.max(0, lastEarnedAt + millisPerPermit - now);
    }

    public synchronized long availablePermits() {
        earn(clock.getAsLong());
        return permits;
    }

    private void earn(long now) {
        long earned = (now - lastEarnedAt) / millisPerPermit;
        if (earned > 0) {
            permits = Math.min(capacity, permits + earned);
            lastEarnedAt += earned * millisPerPermit;
        }
    }
}
