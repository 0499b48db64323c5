package com.chartsayer.position.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Process-local {@link KeyValueStore} for running without Redis and for tests.
 *
 * <p>Values are kept as JSON strings so the serialization path matches Redis. Expiry is
 * checked lazily on access. Sets keep insertion order and are replaced copy-on-write
 * inside {@link ConcurrentHashMap#compute}, so readers never see a set mid-update.
 * Strings and sets share one key space, as in Redis.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private record StoredValue(String json, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final ConcurrentHashMap<String, StoredValue> values = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> sets   = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryKeyValueStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public Mono<Boolean> setJson(String key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> {
                String json = objectMapper.writeValueAsString(value);
                Instant expiresAt = ttl != null && !ttl.isZero() && !ttl.isNegative()
                    ? clock.instant().plus(ttl)
                    : null;
                sets.remove(key);
                values.put(key, new StoredValue(json, expiresAt));
                return true;
            })
            .onErrorResume(e -> {
                log.error("In-memory write failed. key={}", key, e);
                return Mono.just(false);
            });
    }

    @Override
    public <T> Mono<T> getJson(String key, Class<T> type) {
        return Mono.fromCallable(() -> liveValue(key))
            .flatMap(stored -> Mono.fromCallable(() -> objectMapper.readValue(stored.json(), type)))
            .onErrorResume(e -> {
                log.error("In-memory read failed. key={}", key, e);
                return Mono.empty();
            });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.fromCallable(() -> {
            values.remove(key);
            sets.remove(key);
            return true;
        });
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return Mono.fromCallable(() -> liveValue(key) != null || sets.containsKey(key));
    }

    @Override
    public Flux<String> keys(String pattern) {
        return Flux.defer(() -> {
            Pattern regex = Pattern.compile(globToRegex(pattern));
            Instant now = clock.instant();
            TreeSet<String> matches = new TreeSet<>();
            values.forEach((key, stored) -> {
                if (!stored.isExpired(now) && regex.matcher(key).matches()) {
                    matches.add(key);
                }
            });
            sets.keySet().stream().filter(key -> regex.matcher(key).matches()).forEach(matches::add);
            return Flux.fromIterable(matches);
        }).onErrorResume(e -> {
            log.error("In-memory key scan failed. pattern={}", pattern, e);
            return Flux.empty();
        });
    }

    @Override
    public Mono<Long> addToSet(String key, String... members) {
        if (members == null || members.length == 0) {
            return Mono.just(0L);
        }
        return Mono.fromCallable(() -> {
            AtomicLong added = new AtomicLong();
            values.remove(key);
            sets.compute(key, (k, current) -> {
                Set<String> next = current == null ? new LinkedHashSet<>() : new LinkedHashSet<>(current);
                for (String member : members) {
                    if (next.add(member)) {
                        added.incrementAndGet();
                    }
                }
                return Collections.unmodifiableSet(next);
            });
            return added.get();
        });
    }

    @Override
    public Mono<Set<String>> getSetMembers(String key) {
        return Mono.fromCallable(() -> sets.getOrDefault(key, Set.of()));
    }

    @Override
    public Mono<Long> removeFromSet(String key, String... members) {
        if (members == null || members.length == 0) {
            return Mono.just(0L);
        }
        return Mono.fromCallable(() -> {
            AtomicLong removed = new AtomicLong();
            sets.computeIfPresent(key, (k, current) -> {
                Set<String> next = new LinkedHashSet<>(current);
                Arrays.stream(members).filter(next::remove).forEach(m -> removed.incrementAndGet());
                // an emptied set disappears, like in Redis
                return next.isEmpty() ? null : Collections.unmodifiableSet(next);
            });
            return removed.get();
        });
    }

    private StoredValue liveValue(String key) {
        StoredValue stored = values.get(key);
        if (stored != null && stored.isExpired(clock.instant())) {
            values.remove(key, stored);
            return null;
        }
        return stored;
    }

    /**
     * Translates a Redis-style glob into a Java regex. Supports {@code *}, {@code ?},
     * character classes and backslash escapes.
     */
    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                    regex.append(']');
                } else if (c == '\\' && i + 1 < glob.length()) {
                    appendClassLiteral(regex, glob.charAt(++i));
                } else if (c == '[' || c == '&') {
                    regex.append('\\').append(c);
                } else {
                    regex.append(c);
                }
                continue;
            }
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    inClass = true;
                    regex.append('[');
                }
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    } else {
                        regex.append("\\\\");
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        if (inClass) {
            regex.append(']');
        }
        return regex.toString();
    }

    private static void appendClassLiteral(StringBuilder regex, char c) {
        if (Character.isLetterOrDigit(c)) {
            regex.append(c);
        } else {
            regex.append('\\').append(c);
        }
    }
}
