package com.delta.digest.tracker.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class DedupLedger {
    private static final Logger log = LoggerFactory.getLogger(DedupLedger.class);

    private final KeyValueStore store;

    public DedupLedger(KeyValueStore store) {
        this.store = store;
    }

    public boolean isSeen(String itemId) {
        return itemId != null && store.setIsMember(StoreKeys.SEEN_ITEMS, itemId);
    }

    public long markSeen(Collection<String> itemIds) {
        if (itemIds == null || itemIds.isEmpty()) {
            return 0;
        }
        return store.setAdd(StoreKeys.SEEN_ITEMS, itemIds);
    }

    public void recordRun(Instant when) {
        store.set(StoreKeys.LAST_RUN, when.toString(), null);
    }

    public Optional<Instant> lastRun() {
        Optional<String> raw = store.get(StoreKeys.LAST_RUN);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(raw.get()));
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unreadable last run timestamp {}", raw.get());
            return Optional.empty();
        }
    }

    public long seenCount() {
        return store.setCardinality(StoreKeys.SEEN_ITEMS);
    }

    public long clear() {
        return store.delete(List.of(StoreKeys.SEEN_ITEMS, StoreKeys.LAST_RUN));
    }
}
