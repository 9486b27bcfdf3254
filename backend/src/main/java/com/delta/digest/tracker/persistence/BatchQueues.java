package com.delta.digest.tracker.persistence;

import com.delta.digest.tracker.model.DiscoveryTarget;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-job FIFO queues. Dequeue removes entries before the caller works on them, so a crash between
 * dequeue and persisting results loses those entries.
 */
@Repository
public class BatchQueues {
    private final KeyValueStore store;
    private final JsonCodec codec;

    public BatchQueues(KeyValueStore store, JsonCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    public long enqueueDiscoveryTargets(String jobId, List<DiscoveryTarget> targets) {
        if (targets == null || targets.isEmpty()) {
            return store.listLength(StoreKeys.discoveryQueue(jobId));
        }
        List<String> entries = new ArrayList<>(targets.size());
        for (DiscoveryTarget target : targets) {
            entries.add(codec.write(target));
        }
        return store.listPush(StoreKeys.discoveryQueue(jobId), entries);
    }

    public List<DiscoveryTarget> dequeueDiscoveryBatch(String jobId, int max) {
        List<DiscoveryTarget> targets = new ArrayList<>();
        for (String entry : store.listPop(StoreKeys.discoveryQueue(jobId), max)) {
            targets.add(codec.read(entry, DiscoveryTarget.class));
        }
        return targets;
    }

    public boolean discoveryQueueEmpty(String jobId) {
        return pendingDiscovery(jobId) == 0;
    }

    public long pendingDiscovery(String jobId) {
        return store.listLength(StoreKeys.discoveryQueue(jobId));
    }

    public long enqueueFetchTargets(String jobId, List<String> itemIds) {
        if (itemIds == null || itemIds.isEmpty()) {
            return store.listLength(StoreKeys.fetchQueue(jobId));
        }
        return store.listPush(StoreKeys.fetchQueue(jobId), itemIds);
    }

    public List<String> dequeueFetchBatch(String jobId, int max) {
        return store.listPop(StoreKeys.fetchQueue(jobId), max);
    }

    public boolean fetchQueueEmpty(String jobId) {
        return pendingFetch(jobId) == 0;
    }

    public long pendingFetch(String jobId) {
        return store.listLength(StoreKeys.fetchQueue(jobId));
    }
}
