package com.delta.listingimport.ingest.external;

import com.delta.listingimport.ingest.error.TransientNetworkException;
import com.delta.listingimport.ingest.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Bounded retry for {@link TransientNetworkException}. Delay before retry n (1-based) is
 * {@code min(base * 2^(n-1), max)} plus up to {@code jitterRatio} of that again.
 */
public class RetryWithBackoff {
    private static final Logger log = LoggerFactory.getLogger(RetryWithBackoff.class);

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryWithBackoff(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterRatio, Sleeper sleeper) {
        this(maxAttempts, baseDelayMs, maxDelayMs, jitterRatio, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryWithBackoff(
        int maxAttempts,
        long baseDelayMs,
        long maxDelayMs,
        double jitterRatio,
        Sleeper sleeper,
        DoubleSupplier random
    ) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterRatio = jitterRatio;
        this.sleeper = sleeper;
        this.random = random;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientNetworkException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long delay = delayForRetry(attempt);
                log.info("{} attempt {}/{} failed ({}); retrying in {}ms", operation, attempt, maxAttempts, e.getMessage(), delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    long delayForRetry(int retry) {
        long exponential = baseDelayMs * (1L << Math.min(30, Math.max(0, retry - 1)));
        long capped = Math.min(exponential, maxDelayMs);
        long jitter = Math.round(random.getAsDouble() * jitterRatio * capped);
        return capped + jitter;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
