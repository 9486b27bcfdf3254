package com.delta.digest.tracker.persistence;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * String key-value primitives every piece of orchestrator state is expressed through. List pop,
 * set add and hash set are atomic per call; nothing else is.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * @param ttl expiry for the value, or {@code null} to keep it until deleted
     */
    void set(String key, String value, Duration ttl);

    Optional<String> hashGet(String key, String field);

    void hashSet(String key, Map<String, String> fields);

    Map<String, String> hashGetAll(String key);

    long listPush(String key, List<String> values);

    List<String> listPop(String key, int count);

    long listLength(String key);

    long setAdd(String key, Collection<String> members);

    boolean setIsMember(String key, String member);

    Set<String> setMembers(String key);

    long setCardinality(String key);

    Set<String> keysMatching(String pattern);

    long delete(Collection<String> keys);
}
