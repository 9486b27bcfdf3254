package com.delta.digest.tracker.persistence;

import com.delta.digest.tracker.support.TrackerHarness;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DedupLedgerTest {
    private final TrackerHarness harness = new TrackerHarness();
    private final DedupLedger ledger = harness.ledger;

    @Test
    void markSeenIsPermanentAndIdempotent() {
        assertThat(ledger.markSeen(List.of("1", "2"))).isEqualTo(2);
        assertThat(ledger.markSeen(List.of("2"))).isZero();

        assertThat(ledger.isSeen("1")).isTrue();
        assertThat(ledger.isSeen("3")).isFalse();
        assertThat(ledger.seenCount()).isEqualTo(2);
    }

    @Test
    void lastRunRoundTripsAndClearResets() {
        assertThat(ledger.lastRun()).isEmpty();

        ledger.recordRun(TrackerHarness.NOW);
        ledger.markSeen(List.of("1"));
        assertThat(ledger.lastRun()).contains(TrackerHarness.NOW);

        assertThat(ledger.clear()).isEqualTo(2);
        assertThat(ledger.lastRun()).isEmpty();
        assertThat(ledger.seenCount()).isZero();
    }

    @Test
    void unreadableLastRunIsIgnored() {
        harness.store.set(StoreKeys.LAST_RUN, "yesterday", null);

        assertThat(ledger.lastRun()).isEmpty();
    }
}
