package tally.adapter.out.counter.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import tally.core.port.out.CounterStore;

/**
 * Single-instance counter store backed by a {@link ConcurrentMap}.
 *
 * <p>Each increment runs inside {@link ConcurrentMap#compute}, which makes increment and
 * expiry one atomic step per key. Expired entries behave as absent and are dropped lazily.
 *
 * <p>Counters are not shared between instances; use the Redis store for multi-instance
 * deployments.
 */
public class InMemoryCounterStore implements CounterStore {

    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<Long> increment(String key, long amount, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = clock.instant();
            return counters.compute(key, (k, existing) -> {
                        if (existing == null || existing.isExpired(now)) {
                            return new Counter(amount, now.plus(ttl));
                        }
                        final var expiresAt = existing.expiresAt() != null ? existing.expiresAt() : now.plus(ttl);
                        return new Counter(existing.value() + amount, expiresAt);
                    })
                    .value();
        });
    }

    @Override
    public Uni<Optional<Long>> get(String key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(live(key)).map(Counter::value));
    }

    @Override
    public Multi<List<String>> scan(String pattern, int batchSize) {
        return Multi.createFrom()
                .deferred(() -> Multi.createFrom().iterable(matchingKeys(pattern)))
                .group()
                .intoLists()
                .of(batchSize);
    }

    /**
     * Remaining time to live of a key, empty if the key is absent.
     */
    public Optional<Duration> ttl(String key) {
        return Optional.ofNullable(live(key))
                .map(counter -> Duration.between(clock.instant(), counter.expiresAt()));
    }

    /**
     * Drop all counters.
     */
    public void clear() {
        counters.clear();
    }

    private List<String> matchingKeys(String pattern) {
        final var regex = globToRegex(pattern);
        final var matching = new ArrayList<String>();
        for (final var key : counters.keySet()) {
            if (regex.matcher(key).matches() && live(key) != null) {
                matching.add(key);
            }
        }
        return matching;
    }

    private Counter live(String key) {
        final var counter = counters.get(key);
        if (counter == null) {
            return null;
        }
        if (counter.isExpired(clock.instant())) {
            counters.remove(key, counter);
            return null;
        }
        return counter;
    }

    /**
     * Translate a Redis-style glob ({@code *}, {@code ?}, {@code [...]}, backslash escapes)
     * into an anchored regex.
     */
    static Pattern globToRegex(String glob) {
        final var regex = new StringBuilder(glob.length() + 8);
        var inClass = false;
        for (var i = 0; i < glob.length(); i++) {
            final var c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
            } else if (inClass) {
                if (c == ']') {
                    inClass = false;
                    regex.append(']');
                } else if (c == '^' || c == '[' || c == '&') {
                    regex.append('\\').append(c);
                } else {
                    regex.append(c);
                }
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                inClass = true;
                regex.append('[');
                if (i + 1 < glob.length() && (glob.charAt(i + 1) == '^' || glob.charAt(i + 1) == '!')) {
                    regex.append('^');
                    i++;
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        if (inClass) {
            regex.append(']');
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private record Counter(long value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
