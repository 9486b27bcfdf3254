package com.delta.digest.tracker.persistence;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.model.Item;
import com.delta.digest.tracker.model.Job;
import com.delta.digest.tracker.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.UnaryOperator;

/**
 * Job and Item records over the key-value store. The active-job pointer is only read and written
 * here. Every job mutation refreshes {@code updatedAt}, which the stuck-job check treats as the
 * liveness heartbeat.
 */
@Repository
public class JobRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JobRecordStore.class);
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_SUFFIX_LENGTH = 6;

    private final KeyValueStore store;
    private final JsonCodec codec;
    private final Clock clock;
    private final TrackerProperties properties;

    public JobRecordStore(KeyValueStore store, JsonCodec codec, Clock clock, TrackerProperties properties) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.properties = properties;
    }

    public Job create(int discoveryTargets) {
        Instant now = clock.instant();
        Job job = Job.started(nextJobId(now), now, discoveryTargets);
        save(job);
        store.set(StoreKeys.ACTIVE_JOB, job.id(), null);
        store.set(StoreKeys.LAST_JOB, job.id(), null);
        return job;
    }

    public Optional<Job> find(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        return store.get(StoreKeys.job(jobId)).map(json -> codec.read(json, Job.class));
    }

    public Job require(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public Optional<Job> findActive() {
        return store.get(StoreKeys.ACTIVE_JOB).flatMap(this::find);
    }

    public Optional<Job> findActiveOrLast() {
        Optional<Job> active = findActive();
        if (active.isPresent()) {
            return active;
        }
        return store.get(StoreKeys.LAST_JOB).flatMap(this::find);
    }

    public Job update(String jobId, UnaryOperator<Job> mutation) {
        Job current = require(jobId);
        Job updated = mutation.apply(current).withUpdatedAt(clock.instant());
        save(updated);
        return updated;
    }

    /**
     * Moves the job from {@code expected} to {@code next}. Returns empty without writing when the
     * job is no longer in {@code expected}, which is how a duplicate delivery that lost the race
     * ends up as a no-op.
     */
    public Optional<Job> transition(String jobId, JobStatus expected, JobStatus next, UnaryOperator<Job> mutation) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalJobTransitionException(jobId, expected, next);
        }
        Job current = require(jobId);
        if (current.status() != expected) {
            log.info("Job {} is {} not {}, skipping transition to {}",
                jobId, current.status().wireName(), expected.wireName(), next.wireName());
            return Optional.empty();
        }
        return Optional.of(write(current, next, mutation));
    }

    public Optional<Job> transition(String jobId, JobStatus expected, JobStatus next) {
        return transition(jobId, expected, next, UnaryOperator.identity());
    }

    public Optional<Job> fail(String jobId, String error) {
        Optional<Job> current = find(jobId);
        if (current.isEmpty()) {
            log.warn("Cannot mark missing job {} as failed: {}", jobId, error);
            return Optional.empty();
        }
        Job job = current.get();
        if (job.status().isTerminal()) {
            log.info("Job {} already {}, not marking failed", jobId, job.status().wireName());
            return Optional.empty();
        }
        return Optional.of(write(job, JobStatus.FAILED, j -> j.withError(error)));
    }

    public void addItems(String jobId, List<Item> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (Item item : items) {
            fields.put(item.id(), codec.write(item));
        }
        store.hashSet(StoreKeys.items(jobId), fields);
    }

    public Optional<Item> findItem(String jobId, String itemId) {
        return store.hashGet(StoreKeys.items(jobId), itemId).map(json -> codec.read(json, Item.class));
    }

    public boolean containsItem(String jobId, String itemId) {
        return store.hashGet(StoreKeys.items(jobId), itemId).isPresent();
    }

    public void updateItem(String jobId, Item item) {
        store.hashSet(StoreKeys.items(jobId), Map.of(item.id(), codec.write(item)));
    }

    public List<Item> allItems(String jobId) {
        List<Item> items = new ArrayList<>();
        for (String json : store.hashGetAll(StoreKeys.items(jobId)).values()) {
            items.add(codec.read(json, Item.class));
        }
        items.sort(Comparator.comparingInt(Item::discoveryOrder).thenComparing(Item::id));
        return items;
    }

    public int itemCount(String jobId) {
        return store.hashGetAll(StoreKeys.items(jobId)).size();
    }

    public Set<String> jobKeys() {
        return store.keysMatching(StoreKeys.JOB_KEY_PATTERN);
    }

    public long deleteAll() {
        List<String> keys = new ArrayList<>(jobKeys());
        keys.add(StoreKeys.ACTIVE_JOB);
        keys.add(StoreKeys.LAST_JOB);
        return store.delete(keys);
    }

    private Job write(Job current, JobStatus next, UnaryOperator<Job> mutation) {
        Instant now = clock.instant();
        Job updated = mutation.apply(current).withStatus(next).withUpdatedAt(now);
        if (next.isTerminal()) {
            updated = updated.withCompletedAt(now);
        }
        save(updated);
        if (next.isTerminal()) {
            releaseActivePointer(updated.id());
        }
        log.info("Job {} {} -> {}", updated.id(), current.status().wireName(), next.wireName());
        return updated;
    }

    private void releaseActivePointer(String jobId) {
        Optional<String> active = store.get(StoreKeys.ACTIVE_JOB);
        if (active.isPresent() && active.get().equals(jobId)) {
            store.delete(List.of(StoreKeys.ACTIVE_JOB));
        }
    }

    private void save(Job job) {
        Duration ttl = Duration.ofHours(properties.getJob().getRecordTtlHours());
        store.set(StoreKeys.job(job.id()), codec.write(job), ttl);
    }

    private String nextJobId(Instant now) {
        StringBuilder suffix = new StringBuilder(ID_SUFFIX_LENGTH);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return String.format(Locale.ROOT, "%013d-%s", now.toEpochMilli(), suffix);
    }
}
