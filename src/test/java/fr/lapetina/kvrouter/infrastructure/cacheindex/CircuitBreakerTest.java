package fr.lapetina.kvrouter.infrastructure.cacheindex;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        breaker = new CircuitBreaker("controller:9000", 3, Duration.ofSeconds(10), clock);
    }

    @Test
    @DisplayName("should stay closed below the failure threshold")
    void closedBelowThreshold() {
        breaker.recordFailure();
        breaker.recordFailure();

        assertThat(breaker.allowRequest()).isTrue();
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("should open after consecutive failures")
    void opensAtThreshold() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordFailure();

        assertThat(breaker.isOpen()).isTrue();
        assertThat(breaker.allowRequest()).isFalse();
    }

    @Test
    @DisplayName("a success resets the failure count")
    void successResets() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertThat(breaker.allowRequest()).isTrue();
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("should let a probe through after the cooldown")
    void probeAfterCooldown() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }

        clock.advance(Duration.ofSeconds(9));
        assertThat(breaker.allowRequest()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    @DisplayName("should let only one probe through while it is in flight")
    void singleProbe() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(10));

        assertThat(breaker.isOpen()).isFalse();
        assertThat(breaker.allowRequest()).isTrue();
        assertThat(breaker.allowRequest()).isFalse();
        assertThat(breaker.isOpen()).isTrue();

        breaker.recordSuccess();
        assertThat(breaker.allowRequest()).isTrue();
        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    @DisplayName("concurrent callers after the cooldown share a single probe")
    void concurrentProbe() throws Exception {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(10));

        int threads = 32;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger allowed = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                if (breaker.allowRequest()) {
                    allowed.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertThat(allowed.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("a probe that never reports is retried after another cooldown")
    void lostProbe() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(10));
        assertThat(breaker.allowRequest()).isTrue();

        clock.advance(Duration.ofSeconds(10));
        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    @DisplayName("a failed probe re-opens for another cooldown")
    void failedProbe() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(10));

        breaker.recordFailure();

        assertThat(breaker.allowRequest()).isFalse();
        clock.advance(Duration.ofSeconds(10));
        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    @DisplayName("a successful probe closes the breaker")
    void successfulProbe() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(10));

        breaker.recordSuccess();
        breaker.recordFailure();

        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    @DisplayName("should reject a non-positive threshold")
    void invalidThreshold() {
        assertThatThrownBy(() -> new CircuitBreaker("x", 0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
