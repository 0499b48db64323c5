package com.chartsayer.position.storage;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Set;

/**
 * Minimal async key-value contract the position registry is built on.
 *
 * <p>Every operation is a self-contained round trip, atomic for a single key.
 * There are no multi-key transactions. Backend failures never surface as errors:
 * they are logged and mapped to {@code false}, {@code 0}, an empty collection or
 * an empty {@link Mono}. A missing key and an unreachable backend therefore look
 * the same to {@link #getJson}.
 */
public interface KeyValueStore {

    /** Serializes {@code value} to JSON and stores it, with an optional expiry ({@code null} = none). */
    Mono<Boolean> setJson(String key, Object value, Duration ttl);

    /** Empty when the key is absent, expired, unreadable or the backend failed. */
    <T> Mono<T> getJson(String key, Class<T> type);

    Mono<Boolean> delete(String key);

    Mono<Boolean> exists(String key);

    /** Keys matching a glob pattern ({@code *}, {@code ?}, {@code [...]}), sorted ascending. */
    Flux<String> keys(String pattern);

    /** Returns the number of values newly added. */
    Mono<Long> addToSet(String key, String... values);

    Mono<Set<String>> getSetMembers(String key);

    /** Returns the number of values actually removed. */
    Mono<Long> removeFromSet(String key, String... values);
}
