package com.phillippitts.jobpipeline.store;

import com.phillippitts.jobpipeline.exception.StoreUnavailableException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed client for the shared key-value store that request handlers and workers use to
 * agree on state.
 *
 * <p>Every operation either completes or throws {@link StoreUnavailableException}; callers
 * decide whether to fail open or propagate. Operations documented as atomic are executed
 * as a single server-side step, so concurrent callers on any node observe them as
 * indivisible.
 *
 * <p>Implementations must be thread-safe.
 */
public interface CoordinationStore {

    /**
     * Reads a string value.
     *
     * @param key key
     * @return the value, or empty if the key is missing or expired
     */
    Optional<String> get(String key);

    /**
     * Writes a string value that expires after {@code ttl}.
     *
     * @param key   key
     * @param value value
     * @param ttl   time to live, must be positive
     */
    void set(String key, String value, Duration ttl);

    /**
     * Deletes a key of any type.
     *
     * @return true if the key existed
     */
    boolean delete(String key);

    boolean exists(String key);

    /**
     * Atomically adds {@code amount} to an integer value, creating it at zero first.
     *
     * @return the value after the increment
     */
    long increment(String key, long amount);

    /**
     * Atomically adds {@code amount} to an integer value and, when the key has no expiry
     * yet (it was just created), attaches {@code ttl}. The counter and its expiry are set
     * in one step, so a counter can never be left without a TTL.
     *
     * @return the value after the increment
     */
    long incrementAndExpire(String key, long amount, Duration ttl);

    /**
     * Replaces the hash stored at {@code key} with {@code fields}.
     *
     * @param ttl time to live, or null for no expiry
     */
    void setHash(String key, Map<String, String> fields, Duration ttl);

    /**
     * Reads all fields of a hash.
     *
     * @return the fields, or empty if the key is missing or expired
     */
    Optional<Map<String, String>> getHash(String key);

    /**
     * Atomically merges {@code fields} into an existing hash. Never creates the hash and
     * keeps its remaining TTL.
     *
     * @return true if the hash existed and was updated
     */
    boolean updateHashIfPresent(String key, Map<String, String> fields);

    /**
     * Atomically merges {@code updates} into the hash only if {@code field} currently
     * equals {@code expected}.
     *
     * @return true if the comparison matched and the updates were written
     */
    boolean compareAndSetHash(String key, String field, String expected, Map<String, String> updates);

    void addToSet(String key, String member);

    void removeFromSet(String key, String member);

    /**
     * @return all members, empty if the set does not exist
     */
    Set<String> members(String key);

    /**
     * Adds or moves {@code member} in the schedule at {@code key} so it becomes due at
     * {@code readyAt}.
     */
    void schedule(String key, String member, Instant readyAt);

    /**
     * Atomically removes and returns the earliest member whose ready time is not after
     * {@code now}. Two concurrent callers never receive the same member.
     *
     * @return the due member, or empty if none is due
     */
    Optional<String> popDue(String key, Instant now);

    /**
     * @return true if {@code member} was scheduled and has been removed
     */
    boolean unschedule(String key, String member);

    boolean isScheduled(String key, String member);

    /**
     * Checks connectivity. Never throws.
     *
     * @return true if the store answered
     */
    boolean ping();
}
