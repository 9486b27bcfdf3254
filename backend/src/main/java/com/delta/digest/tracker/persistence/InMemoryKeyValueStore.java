package com.delta.digest.tracker.persistence;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

@Repository
@ConditionalOnProperty(prefix = "tracker.store", name = "backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryKeyValueStore implements KeyValueStore {
    private final Clock clock;
    private final Map<String, String> values = new HashMap<>();
    private final Map<String, Instant> expiries = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<String, Deque<String>> lists = new HashMap<>();
    private final Map<String, Set<String>> sets = new HashMap<>();

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        evictIfExpired(key);
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        values.put(key, value);
        if (ttl == null) {
            expiries.remove(key);
        } else {
            expiries.put(key, clock.instant().plus(ttl));
        }
    }

    @Override
    public synchronized Optional<String> hashGet(String key, String field) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? Optional.empty() : Optional.ofNullable(hash.get(field));
    }

    @Override
    public synchronized void hashSet(String key, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return;
        }
        hashes.computeIfAbsent(key, ignored -> new LinkedHashMap<>()).putAll(fields);
    }

    @Override
    public synchronized Map<String, String> hashGetAll(String key) {
        Map<String, String> hash = hashes.get(key);
        return hash == null ? Map.of() : new LinkedHashMap<>(hash);
    }

    @Override
    public synchronized long listPush(String key, List<String> entries) {
        Deque<String> list = lists.computeIfAbsent(key, ignored -> new ArrayDeque<>());
        if (entries != null) {
            list.addAll(entries);
        }
        return list.size();
    }

    @Override
    public synchronized List<String> listPop(String key, int count) {
        Deque<String> list = lists.get(key);
        List<String> out = new ArrayList<>();
        if (list == null) {
            return out;
        }
        while (out.size() < count && !list.isEmpty()) {
            out.add(list.pollFirst());
        }
        if (list.isEmpty()) {
            lists.remove(key);
        }
        return out;
    }

    @Override
    public synchronized long listLength(String key) {
        Deque<String> list = lists.get(key);
        return list == null ? 0 : list.size();
    }

    @Override
    public synchronized long setAdd(String key, Collection<String> members) {
        if (members == null || members.isEmpty()) {
            return 0;
        }
        Set<String> set = sets.computeIfAbsent(key, ignored -> new LinkedHashSet<>());
        long added = 0;
        for (String member : members) {
            if (set.add(member)) {
                added++;
            }
        }
        return added;
    }

    @Override
    public synchronized boolean setIsMember(String key, String member) {
        Set<String> set = sets.get(key);
        return set != null && set.contains(member);
    }

    @Override
    public synchronized Set<String> setMembers(String key) {
        Set<String> set = sets.get(key);
        return set == null ? Set.of() : new LinkedHashSet<>(set);
    }

    @Override
    public synchronized long setCardinality(String key) {
        Set<String> set = sets.get(key);
        return set == null ? 0 : set.size();
    }

    @Override
    public synchronized Set<String> keysMatching(String pattern) {
        Pattern regex = globToRegex(pattern);
        Set<String> candidates = new TreeSet<>();
        for (String key : new ArrayList<>(values.keySet())) {
            evictIfExpired(key);
        }
        candidates.addAll(values.keySet());
        candidates.addAll(hashes.keySet());
        candidates.addAll(lists.keySet());
        candidates.addAll(sets.keySet());
        candidates.removeIf(key -> !regex.matcher(key).matches());
        return candidates;
    }

    @Override
    public synchronized long delete(Collection<String> keys) {
        if (keys == null) {
            return 0;
        }
        long deleted = 0;
        for (String key : new LinkedHashSet<>(keys)) {
            evictIfExpired(key);
            boolean existed = values.remove(key) != null;
            expiries.remove(key);
            existed |= hashes.remove(key) != null;
            existed |= lists.remove(key) != null;
            existed |= sets.remove(key) != null;
            if (existed) {
                deleted++;
            }
        }
        return deleted;
    }

    private void evictIfExpired(String key) {
        Instant expiresAt = expiries.get(key);
        if (expiresAt != null && !expiresAt.isAfter(clock.instant())) {
            values.remove(key);
            expiries.remove(key);
        }
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (String part : (glob == null ? "" : glob).split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.toString());
    }
}
