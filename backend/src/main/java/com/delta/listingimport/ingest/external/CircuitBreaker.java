package com.delta.listingimport.ingest.external;

import com.delta.listingimport.ingest.error.CircuitOpenException;
import com.delta.listingimport.ingest.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Consecutive-failure breaker. Opens after {@code failureThreshold} failures in a row, admits a single
 * trial call once {@code openTimeout} has passed, and closes after {@code successThreshold} trial successes.
 * All counter updates happen under the instance lock.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration openTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, int successThreshold, Duration openTimeout, Clock clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.successThreshold = Math.max(1, successThreshold);
        this.openTimeout = openTimeout;
        this.clock = clock;
    }

    public <T> T execute(Supplier<T> call) {
        return execute(call, null);
    }

    /**
     * Runs the call if the breaker admits it. When it does not, returns the fallback's value, or throws
     * {@link CircuitOpenException} if there is no fallback. Call failures, errors included, are recorded
     * and rethrown so a half-open trial never stays claimed.
     */
    public <T> T execute(Supplier<T> call, Supplier<T> fallback) {
        if (!tryAcquire()) {
            if (fallback != null) {
                log.debug("Circuit {} is {}; serving fallback", name, currentState());
                return fallback.get();
            }
            throw new CircuitOpenException("Circuit " + name + " is open; upstream temporarily unavailable");
        }
        T result;
        try {
            result = call.get();
        } catch (ValidationException e) {
            releaseTrial();
            throw e;
        } catch (RuntimeException | Error e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    private synchronized boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (lastFailureTime != null && !clock.instant().isBefore(lastFailureTime.plus(openTimeout))) {
                    state = CircuitState.HALF_OPEN;
                    successCount = 0;
                    trialInFlight = true;
                    log.info("Circuit {} HALF_OPEN; admitting trial call", name);
                    return true;
                }
                return false;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                return false;
        }
    }

    private synchronized void releaseTrial() {
        trialInFlight = false;
    }

    private synchronized void onSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            successCount++;
            if (successCount >= successThreshold) {
                state = CircuitState.CLOSED;
                failureCount = 0;
                successCount = 0;
                log.info("Circuit {} CLOSED; upstream recovered", name);
            }
            return;
        }
        failureCount = 0;
    }

    private synchronized void onFailure() {
        lastFailureTime = clock.instant();
        successCount = 0;
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            state = CircuitState.OPEN;
            log.warn("Circuit {} trial call failed; OPEN again", name);
            return;
        }
        failureCount++;
        if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            state = CircuitState.OPEN;
            log.warn("Circuit {} OPEN after {} consecutive failures", name, failureCount);
        }
    }

    public synchronized CircuitState currentState() {
        return state;
    }

    public synchronized CircuitBreakerStats stats() {
        Instant nextAttempt = state == CircuitState.OPEN && lastFailureTime != null
            ? lastFailureTime.plus(openTimeout)
            : null;
        return new CircuitBreakerStats(state, failureCount, successCount, lastFailureTime, nextAttempt);
    }

    public synchronized void reset() {
        log.info("Circuit {} manually reset to CLOSED", name);
        state = CircuitState.CLOSED;
        failureCount = 0;
        successCount = 0;
        lastFailureTime = null;
        trialInFlight = false;
    }
}
