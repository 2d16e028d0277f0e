package tally.adapter.out.counter.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tally.core.model.common.CounterStoreUnavailableException;
import tally.core.port.out.Metrics;

@DisplayName("RedisTimeoutHelper")
@ExtendWith(MockitoExtension.class)
class RedisTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String OPERATION_NAME = "increment";

    @Mock
    private Metrics metrics;

    private RedisTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new RedisTimeoutHelper(TIMEOUT, metrics);
    }

    @Nested
    @DisplayName("withTimeout(Uni)")
    class UniTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResultWithinTimeout() {
            final var result =
                    helper.withTimeout(Uni.createFrom().item(42L), OPERATION_NAME).await().indefinitely();

            assertEquals(42L, result);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should fail with CounterStoreUnavailableException on timeout")
        void shouldFailOnTimeout() {
            final var operation = Uni.createFrom().<Long>nothing();

            final var exception = assertThrows(
                    CounterStoreUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertEquals(OPERATION_NAME, exception.getOperation());
            assertTrue(exception.getMessage().contains("timed out"));
            verify(metrics).recordCounterStoreTimeout(OPERATION_NAME);
            verify(metrics, never()).recordCounterStoreFailure(OPERATION_NAME);
        }

        @Test
        @DisplayName("should wrap other failures and count them")
        void shouldWrapFailures() {
            final var cause = new IllegalStateException("connection reset");
            final var operation = Uni.createFrom().<Long>failure(cause);

            final var exception = assertThrows(
                    CounterStoreUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertSame(cause, exception.getCause());
            verify(metrics).recordCounterStoreFailure(OPERATION_NAME);
        }
    }

    @Nested
    @DisplayName("withTimeout(Multi)")
    class MultiTests {

        @Test
        @DisplayName("should pass items through")
        void shouldPassItemsThrough() {
            final var items = helper.withTimeout(Multi.createFrom().items("a", "b"), "scan")
                    .collect()
                    .asList()
                    .await()
                    .indefinitely();

            assertEquals(List.of("a", "b"), items);
        }

        @Test
        @DisplayName("should fail when no item arrives in time")
        void shouldFailWhenStalled() {
            final var operation = Multi.createFrom().<String>nothing();

            assertThrows(
                    CounterStoreUnavailableException.class,
                    () -> helper.withTimeout(operation, "scan").collect().asList().await().indefinitely());
            verify(metrics).recordCounterStoreTimeout("scan");
        }
    }
}
