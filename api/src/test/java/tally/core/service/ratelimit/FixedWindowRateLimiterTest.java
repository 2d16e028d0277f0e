package tally.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tally.adapter.out.counter.memory.InMemoryCounterStore;
import tally.core.model.common.CounterStoreUnavailableException;
import tally.core.model.ratelimit.LimitStrategy;
import tally.core.model.ratelimit.RateLimitDecision;
import tally.core.model.ratelimit.StrategyLimit;
import tally.core.port.out.CounterStore;
import tally.core.port.out.Metrics;
import tally.testing.MutableClock;

@DisplayName("FixedWindowRateLimiter")
class FixedWindowRateLimiterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final StrategyLimit LIMIT = StrategyLimit.of(LimitStrategy.CREDENTIAL, 3, 60);

    private MutableClock clock;
    private InMemoryCounterStore store;
    private Metrics metrics;
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:05Z");
        store = new InMemoryCounterStore(clock);
        metrics = mock(Metrics.class);
        limiter = new FixedWindowRateLimiter(store, metrics, clock, "tally:");
    }

    private RateLimitDecision check(String scope) {
        return limiter.check(LIMIT, scope).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Window counting")
    class WindowCountingTests {

        @Test
        @DisplayName("should allow exactly the limit and reject the next request")
        void shouldAllowLimitAndRejectNext() {
            for (int i = 1; i <= 3; i++) {
                var decision = check("key-1");
                assertTrue(decision.allowed(), "Request " + i + " should be allowed");
                assertEquals(3 - i, decision.remaining());
            }

            var rejected = check("key-1");

            assertFalse(rejected.allowed());
            assertEquals(0, rejected.remaining());
            assertEquals(4, rejected.count());
            assertEquals(55, rejected.retryAfterSeconds());
        }

        @Test
        @DisplayName("should start a fresh count in the next window")
        void shouldStartFreshCountInNextWindow() {
            for (int i = 0; i < 4; i++) {
                check("key-1");
            }

            clock.advance(Duration.ofSeconds(61));
            var decision = check("key-1");

            assertTrue(decision.allowed());
            assertEquals(2, decision.remaining());
        }

        @Test
        @DisplayName("should count scopes independently")
        void shouldCountScopesIndependently() {
            for (int i = 0; i < 4; i++) {
                check("key-1");
            }

            assertTrue(check("key-2").allowed());
        }

        @Test
        @DisplayName("should expire the window key after the window length")
        void shouldSetExpiryToWindowLength() {
            check("key-1");

            var ttl = store.ttl("tally:ratelimit:credential:key-1:1714564800");
            assertEquals(Duration.ofSeconds(60), ttl.orElseThrow());
        }

        @Test
        @DisplayName("should report reset at the end of the window")
        void shouldReportResetAtWindowEnd() {
            var decision = check("key-1");

            assertEquals(1714564860L, decision.resetAtEpochSeconds());
        }
    }

    @Nested
    @DisplayName("Counter store failures")
    class FailureTests {

        @Test
        @DisplayName("should fail open with a degraded decision")
        void shouldFailOpen() {
            var failing = mock(CounterStore.class);
            when(failing.increment(anyString(), anyLong(), any()))
                    .thenReturn(Uni.createFrom().failure(new CounterStoreUnavailableException("increment", "down")));
            var degradedLimiter = new FixedWindowRateLimiter(failing, metrics, clock, "tally:");

            var decision = degradedLimiter.check(LIMIT, "key-1").await().atMost(TIMEOUT);

            assertTrue(decision.allowed());
            assertTrue(decision.degraded());
            assertEquals(3, decision.remaining());
            verify(metrics).recordRateLimitCheck(LimitStrategy.CREDENTIAL, true, true);
        }
    }
}
