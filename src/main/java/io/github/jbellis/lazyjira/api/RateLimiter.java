package io.github.jbellis.lazyjira.api;

import com.google.common.base.Ticker;
import java.time.Duration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Token bucket gating outbound requests. One instance per client.
 *
 * <p>The bucket starts full, so the first {@code maxTokens} requests are never throttled. Refill is lazy: elapsed
 * time is converted into tokens whenever the bucket is touched, and there is no background timer. Whole intervals
 * only are credited, and the refill mark advances by exactly those intervals so the remaining fraction is kept.
 *
 * <p>Waiters are not served in FIFO order. A waiter sleeps outside the monitor and re-checks on wake-up, so a caller
 * arriving just after a refill can take the token an older waiter was sleeping for. This is accepted for a
 * single-user client; reuse in a multi-client setting would need a fair queue.
 */
public final class RateLimiter {
    private static final Logger logger = LogManager.getLogger(RateLimiter.class);

    private final int maxTokens;
    private final long refillIntervalNanos;
    private final int tokensPerRefill;
    private final Ticker ticker;
    private final Sleeper sleeper;

    // guarded by this
    private int tokens;
    private long lastRefillNanos;

    public RateLimiter(int maxTokens, Duration refillInterval, int tokensPerRefill) {
        this(maxTokens, refillInterval, tokensPerRefill, Ticker.systemTicker(), Sleeper.SYSTEM);
    }

    public RateLimiter(int maxTokens, Duration refillInterval, int tokensPerRefill, Ticker ticker, Sleeper sleeper) {
        if (maxTokens <= 0 || tokensPerRefill <= 0) {
            throw new IllegalArgumentException("maxTokens and tokensPerRefill must be > 0");
        }
        if (refillInterval.isZero() || refillInterval.isNegative()) {
            throw new IllegalArgumentException("refillInterval must be positive");
        }
        this.maxTokens = maxTokens;
        this.refillIntervalNanos = refillInterval.toNanos();
        this.tokensPerRefill = tokensPerRefill;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.tokens = maxTokens;
        this.lastRefillNanos = ticker.read();
    }

    /** Jira Cloud's published budget: 100 requests, fully replenished every minute. */
    public static RateLimiter jiraCloud() {
        return new RateLimiter(100, Duration.ofSeconds(60), 100);
    }

    /** Blocks until a token is available, then consumes it. */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos;
            synchronized (this) {
                long sinceRefill = refill();
                if (tokens > 0) {
                    tokens--;
                    return;
                }
                waitNanos = refillIntervalNanos - sinceRefill;
            }
            logger.debug("Rate limit reached, waiting {} ms for refill", waitNanos / 1_000_000);
            sleeper.sleep(Duration.ofNanos(waitNanos));
        }
    }

    /** Consumes a token if one is available. Never blocks. */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens > 0) {
            tokens--;
            return true;
        }
        return false;
    }

    public synchronized int availableTokens() {
        refill();
        return tokens;
    }

    /**
     * Credits whole elapsed intervals. Must hold the monitor.
     *
     * @return nanos elapsed since the (possibly advanced) refill mark, always below one interval after a refill
     */
    private long refill() {
        long now = ticker.read();
        long elapsed = now - lastRefillNanos;
        if (elapsed >= refillIntervalNanos) {
            long refills = elapsed / refillIntervalNanos;
            long refilled = tokens + refills * (long) tokensPerRefill;
            tokens = (int) Math.min(maxTokens, refilled);
            lastRefillNanos += refills * refillIntervalNanos;
            elapsed -= refills * refillIntervalNanos;
        }
        return elapsed;
    }
}
