package fr.lapetina.kvrouter.infrastructure.cacheindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Guards calls to the cache-index controller.
 *
 * After {@code failureThreshold} consecutive failures the breaker opens and rejects calls for
 * {@code cooldown}. The first call after the cooldown is let through as a probe; its outcome
 * closes the breaker or re-opens it for another cooldown.
 *
 * Thread-safe via atomic operations. Exactly one caller wins the probe: claiming it pushes the
 * open window out by another cooldown, so the others keep being rejected until the probe
 * reports back. A probe that never reports simply leads to another one a cooldown later.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String target;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<Instant> openUntil = new AtomicReference<>();

    public CircuitBreaker(String target, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be positive: " + failureThreshold);
        }
        this.target = target;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public CircuitBreaker(String target, int failureThreshold, Duration cooldown) {
        this(target, failureThreshold, cooldown, Clock.systemUTC());
    }

    /**
     * @return true if the call should go out
     */
    public boolean allowRequest() {
        Instant until = openUntil.get();
        if (until == null) {
            return true;
        }
        Instant now = clock.instant();
        if (now.isBefore(until)) {
            return false;
        }
        if (openUntil.compareAndSet(until, now.plus(cooldown))) {
            log.info("Circuit breaker half-open, sending probe: target={}", target);
            return true;
        }
        return false;
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
        if (openUntil.getAndSet(null) != null) {
            log.info("Circuit breaker closed: target={}", target);
        }
    }

    public void recordFailure() {
        int failures = consecutiveFailures.incrementAndGet();
        if (failures >= failureThreshold) {
            Instant until = clock.instant().plus(cooldown);
            Instant previous = openUntil.getAndSet(until);
            if (previous == null) {
                log.warn("Circuit breaker opened: target={}, failures={}, cooldownMs={}",
                        target, failures, cooldown.toMillis());
            }
        }
    }

    /**
     * True while calls are rejected. Does not claim the probe.
     */
    public boolean isOpen() {
        Instant until = openUntil.get();
        return until != null && clock.instant().isBefore(until);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "target='" + target + '\'' +
                ", open=" + isOpen() +
                ", failures=" + consecutiveFailures.get() +
                '}';
    }
}
