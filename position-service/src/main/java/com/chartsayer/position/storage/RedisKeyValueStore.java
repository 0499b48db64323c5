package com.chartsayer.position.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link KeyValueStore} over Redis using the reactive Lettuce driver.
 *
 * <p>The template borrows a connection per command and releases it when the command
 * completes, errors or is cancelled; nothing is held between calls.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private static final long SCAN_COUNT = 500;

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    public RedisKeyValueStore(ReactiveStringRedisTemplate redis, ObjectMapper objectMapper) {
        this.redis        = redis;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Boolean> setJson(String key, Object value, Duration ttl) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(value))
            .flatMap(json -> hasExpiry(ttl)
                ? redis.opsForValue().set(key, json, ttl)
                : redis.opsForValue().set(key, json))
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.error("Redis write failed. key={}", key, e);
                return Mono.just(false);
            });
    }

    @Override
    public <T> Mono<T> getJson(String key, Class<T> type) {
        return redis.opsForValue().get(key)
            .flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, type)))
            .onErrorResume(e -> {
                log.error("Redis read failed. key={}", key, e);
                return Mono.empty();
            });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return redis.delete(key)
            .map(removed -> true)
            .onErrorResume(e -> {
                log.error("Redis delete failed. key={}", key, e);
                return Mono.just(false);
            });
    }

    @Override
    public Mono<Boolean> exists(String key) {
        return redis.hasKey(key)
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.error("Redis exists check failed. key={}", key, e);
                return Mono.just(false);
            });
    }

    @Override
    public Flux<String> keys(String pattern) {
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
        return redis.scan(options)
            .distinct()
            .sort()
            .onErrorResume(e -> {
                log.error("Redis key scan failed. pattern={}", pattern, e);
                return Flux.empty();
            });
    }

    @Override
    public Mono<Long> addToSet(String key, String... values) {
        if (values == null || values.length == 0) {
            return Mono.just(0L);
        }
        return redis.opsForSet().add(key, values)
            .defaultIfEmpty(0L)
            .onErrorResume(e -> {
                log.error("Redis set add failed. key={}", key, e);
                return Mono.just(0L);
            });
    }

    @Override
    public Mono<Set<String>> getSetMembers(String key) {
        return redis.opsForSet().members(key)
            .collect(Collectors.toCollection(LinkedHashSet::new))
            .map(members -> (Set<String>) members)
            .onErrorResume(e -> {
                log.error("Redis set read failed. key={}", key, e);
                return Mono.just(Set.of());
            });
    }

    @Override
    public Mono<Long> removeFromSet(String key, String... values) {
        if (values == null || values.length == 0) {
            return Mono.just(0L);
        }
        return redis.opsForSet().remove(key, (Object[]) values)
            .defaultIfEmpty(0L)
            .onErrorResume(e -> {
                log.error("Redis set remove failed. key={}", key, e);
                return Mono.just(0L);
            });
    }

    private static boolean hasExpiry(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }
}
