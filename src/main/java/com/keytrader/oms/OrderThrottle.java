package com.keytrader.oms;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paces order submissions to at most one per interval, backed by a resilience4j
 * {@link RateLimiter} with a single permit per refresh period. Callers block in
 * {@link #acquire()} until their permit's window opens. An interval of zero disables pacing.
 */
public class OrderThrottle {

    private static final Logger log = LoggerFactory.getLogger(OrderThrottle.class);

    private static final Duration MAX_WAIT = Duration.ofSeconds(5);

    private final long minIntervalMillis;
    private final RateLimiter rateLimiter;

    public OrderThrottle(long minIntervalMillis) {
        this.minIntervalMillis = Math.max(0, minIntervalMillis);
        this.rateLimiter = this.minIntervalMillis > 0
                ? RateLimiter.of(
                        "orders",
                        RateLimiterConfig.custom()
                                .limitForPeriod(1)
                                .limitRefreshPeriod(Duration.ofMillis(this.minIntervalMillis))
                                .timeoutDuration(MAX_WAIT)
                                .build())
                : null;
    }

    /**
     * Blocks until the next order may be sent.
     *
     * @throws IllegalStateException if no permit was granted within the maximum wait or the
     *     thread was interrupted while waiting
     */
    public void acquire() {
        if (rateLimiter == null) {
            return;
        }
        if (!rateLimiter.acquirePermission()) {
            throw new IllegalStateException("Order throttle did not grant a permit within " + MAX_WAIT.toMillis()
                    + " ms" + (Thread.currentThread().isInterrupted() ? " (interrupted)" : ""));
        }
        log.trace("Order permit granted");
    }

    public long getMinIntervalMillis() {
        return minIntervalMillis;
    }
}
