package com.phillippitts.jobpipeline.store;

import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link CoordinationStore} backed by Redis (or any Redis-protocol server such as Valkey)
 * through Spring Data Redis.
 *
 * <p>Multi-step primitives run as Lua scripts so the server executes them atomically.
 * Every {@link DataAccessException} raised by the driver, including connection failures
 * and command timeouts, is rethrown as {@link StoreUnavailableException}.
 */
@Component
public class RedisCoordinationStore implements CoordinationStore {

    private static final Logger LOG = LogManager.getLogger(RedisCoordinationStore.class);

    static final RedisScript<Long> INCREMENT_AND_EXPIRE = new DefaultRedisScript<>(
            "local v = redis.call('INCRBY', KEYS[1], ARGV[1]) "
                    + "if redis.call('PTTL', KEYS[1]) < 0 then redis.call('PEXPIRE', KEYS[1], ARGV[2]) end "
                    + "return v",
            Long.class);

    static final RedisScript<Long> REPLACE_HASH = new DefaultRedisScript<>(
            "redis.call('DEL', KEYS[1]) "
                    + "redis.call('HSET', KEYS[1], unpack(ARGV, 2)) "
                    + "if tonumber(ARGV[1]) > 0 then redis.call('PEXPIRE', KEYS[1], ARGV[1]) end "
                    + "return 1",
            Long.class);

    static final RedisScript<Long> UPDATE_HASH_IF_PRESENT = new DefaultRedisScript<>(
            "if redis.call('EXISTS', KEYS[1]) == 0 then return 0 end "
                    + "redis.call('HSET', KEYS[1], unpack(ARGV)) "
                    + "return 1",
            Long.class);

    static final RedisScript<Long> COMPARE_AND_SET_HASH = new DefaultRedisScript<>(
            "if redis.call('HGET', KEYS[1], ARGV[1]) ~= ARGV[2] then return 0 end "
                    + "redis.call('HSET', KEYS[1], unpack(ARGV, 3)) "
                    + "return 1",
            Long.class);

    static final RedisScript<String> POP_DUE = new DefaultRedisScript<>(
            "local ids = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, 1) "
                    + "if #ids == 0 then return false end "
                    + "redis.call('ZREM', KEYS[1], ids[1]) "
                    + "return ids[1]",
            String.class);

    private final StringRedisTemplate redis;

    public RedisCoordinationStore(StringRedisTemplate redis) {
        this.redis = Objects.requireNonNull(redis, "redis");
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET " + key, () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        requirePositive(ttl);
        call("SET " + key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return call("DEL " + key, () -> Boolean.TRUE.equals(redis.delete(key)));
    }

    @Override
    public boolean exists(String key) {
        return call("EXISTS " + key, () -> Boolean.TRUE.equals(redis.hasKey(key)));
    }

    @Override
    public long increment(String key, long amount) {
        return call("INCRBY " + key, () -> {
            Long value = redis.opsForValue().increment(key, amount);
            return value == null ? 0L : value;
        });
    }

    @Override
    public long incrementAndExpire(String key, long amount, Duration ttl) {
        requirePositive(ttl);
        return call("INCRBY+PEXPIRE " + key, () -> {
            Long value = redis.execute(INCREMENT_AND_EXPIRE, List.of(key),
                    Long.toString(amount), Long.toString(ttl.toMillis()));
            return value == null ? 0L : value;
        });
    }

    @Override
    public void setHash(String key, Map<String, String> fields, Duration ttl) {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Hash must have at least one field: " + key);
        }
        if (ttl != null) {
            requirePositive(ttl);
        }
        List<String> args = new ArrayList<>(fields.size() * 2 + 1);
        args.add(ttl == null ? "0" : Long.toString(ttl.toMillis()));
        flatten(fields, args);
        call("HSET " + key, () -> redis.execute(REPLACE_HASH, List.of(key), args.toArray()));
    }

    @Override
    public Optional<Map<String, String>> getHash(String key) {
        return call("HGETALL " + key, () -> {
            Map<String, String> entries = redis.<String, String>opsForHash().entries(key);
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries);
        });
    }

    @Override
    public boolean updateHashIfPresent(String key, Map<String, String> fields) {
        if (fields.isEmpty()) {
            return exists(key);
        }
        List<String> args = new ArrayList<>(fields.size() * 2);
        flatten(fields, args);
        return call("HSET(if present) " + key,
                () -> Long.valueOf(1L).equals(redis.execute(UPDATE_HASH_IF_PRESENT, List.of(key), args.toArray())));
    }

    @Override
    public boolean compareAndSetHash(String key, String field, String expected, Map<String, String> updates) {
        if (updates.isEmpty()) {
            throw new IllegalArgumentException("No updates for compare-and-set on " + key);
        }
        List<String> args = new ArrayList<>(updates.size() * 2 + 2);
        args.add(field);
        args.add(expected);
        flatten(updates, args);
        return call("HSET(compare-and-set) " + key,
                () -> Long.valueOf(1L).equals(redis.execute(COMPARE_AND_SET_HASH, List.of(key), args.toArray())));
    }

    @Override
    public void addToSet(String key, String member) {
        call("SADD " + key, () -> redis.opsForSet().add(key, member));
    }

    @Override
    public void removeFromSet(String key, String member) {
        call("SREM " + key, () -> redis.opsForSet().remove(key, member));
    }

    @Override
    public Set<String> members(String key) {
        return call("SMEMBERS " + key, () -> {
            Set<String> members = redis.opsForSet().members(key);
            return members == null ? Set.of() : members;
        });
    }

    @Override
    public void schedule(String key, String member, Instant readyAt) {
        call("ZADD " + key, () -> redis.opsForZSet().add(key, member, readyAt.toEpochMilli()));
    }

    @Override
    public Optional<String> popDue(String key, Instant now) {
        return call("ZPOP(due) " + key, () -> Optional.ofNullable(
                redis.execute(POP_DUE, List.of(key), Long.toString(now.toEpochMilli()))));
    }

    @Override
    public boolean unschedule(String key, String member) {
        return call("ZREM " + key, () -> {
            Long removed = redis.opsForZSet().remove(key, member);
            return removed != null && removed > 0;
        });
    }

    @Override
    public boolean isScheduled(String key, String member) {
        return call("ZSCORE " + key, () -> redis.opsForZSet().score(key, member) != null);
    }

    @Override
    public boolean ping() {
        try {
            String reply = redis.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(reply);
        } catch (DataAccessException e) {
            LOG.debug("Coordination store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static <T> T call(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(operation, e);
        }
    }

    private static void flatten(Map<String, String> fields, List<String> target) {
        fields.forEach((name, value) -> {
            target.add(name);
            target.add(value == null ? "" : value);
        });
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
    }
}
