package tally.adapter.out.counter.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Command;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Request;
import io.vertx.redis.client.RedisOptions;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs the counter increment script against a real Redis instance.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Redis counter script integration")
class RedisCounterStoreIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Container
    static GenericContainer<?> redis =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private static Vertx vertx;
    private static Redis redisClient;

    @BeforeAll
    static void setUpClass() {
        vertx = Vertx.vertx();
        var options =
                new RedisOptions().setConnectionString("redis://" + redis.getHost() + ":" + redis.getMappedPort(6379));
        redisClient = Redis.createClient(vertx, options);
    }

    @AfterAll
    static void tearDownClass() {
        if (redisClient != null) {
            redisClient.close();
        }
        if (vertx != null) {
            vertx.closeAndAwait();
        }
    }

    @BeforeEach
    void setUp() {
        RedisAPI.api(redisClient).flushall(List.of()).await().atMost(TIMEOUT);
    }

    private long increment(String key, long amount, long ttlSeconds) {
        return redisClient
                .send(Request.cmd(Command.EVAL)
                        .arg(RedisCounterStore.INCREMENT_SCRIPT)
                        .arg("1")
                        .arg(key)
                        .arg(String.valueOf(amount))
                        .arg(String.valueOf(ttlSeconds)))
                .await()
                .atMost(TIMEOUT)
                .toLong();
    }

    private long ttl(String key) {
        return RedisAPI.api(redisClient).ttl(key).await().atMost(TIMEOUT).toLong();
    }

    @Test
    @DisplayName("should return the post-increment value")
    void shouldReturnPostIncrementValue() {
        assertEquals(1, increment("tally:ratelimit:ip:10.0.0.1:1714564800", 1, 120));
        assertEquals(2, increment("tally:ratelimit:ip:10.0.0.1:1714564800", 1, 120));
        assertEquals(12, increment("tally:ratelimit:ip:10.0.0.1:1714564800", 10, 120));
    }

    @Test
    @DisplayName("should set the expiry on first increment only")
    void shouldSetExpiryOnce() {
        var key = "tally:usage:acme:2024-05-01:queries";

        increment(key, 5, 300);
        RedisAPI.api(redisClient).expire(List.of(key, "30")).await().atMost(TIMEOUT);
        increment(key, 5, 300);

        var remaining = ttl(key);
        assertTrue(remaining > 0 && remaining <= 30, "TTL should not be refreshed, was " + remaining);
    }

    @Test
    @DisplayName("should repair a key without expiry")
    void shouldRepairMissingExpiry() {
        var key = "tally:usage:acme:2024-05-01:documents";
        RedisAPI.api(redisClient).set(List.of(key, "7")).await().atMost(TIMEOUT);

        assertEquals(8, increment(key, 1, 300));

        var remaining = ttl(key);
        assertTrue(remaining > 0 && remaining <= 300);
    }

    @Test
    @DisplayName("should not lose increments under concurrency")
    void shouldNotLoseIncrements() throws Exception {
        var key = "tally:usage:acme:2024-05-01:api_calls";
        var threads = 20;
        var perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<?>>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        increment(key, 1, 300);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        var value = RedisAPI.api(redisClient).get(key).await().atMost(TIMEOUT).toLong();
        assertEquals(threads * perThread, value);
    }
}
