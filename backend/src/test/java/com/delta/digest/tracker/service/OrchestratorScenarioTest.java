package com.delta.digest.tracker.service;

import com.delta.digest.tracker.dispatch.ContinuationPublisher;
import com.delta.digest.tracker.model.Item;
import com.delta.digest.tracker.model.ItemGroup;
import com.delta.digest.tracker.model.ItemStatus;
import com.delta.digest.tracker.model.Job;
import com.delta.digest.tracker.model.JobStatus;
import com.delta.digest.tracker.model.PhaseResult;
import com.delta.digest.tracker.model.TriggerResult;
import com.delta.digest.tracker.notify.ItemGroups;
import com.delta.digest.tracker.support.RecordingDispatcher;
import com.delta.digest.tracker.support.TrackerHarness;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.delta.digest.tracker.support.TrackerHarness.item;
import static org.assertj.core.api.Assertions.assertThat;

class OrchestratorScenarioTest {

    @Test
    void fullRunGroupsItemsAndLedgersThem() {
        TrackerHarness harness = new TrackerHarness()
            .source("alpha", "http://forum.test/alpha")
            .source("beta", "http://forum.test/beta");
        harness.properties.getJob().setDiscoveryBatchSize(1);
        harness.properties.getJob().setMinSizeForContent(100);
        harness.scraper
            .listing("http://forum.test/alpha", item("a1", "2025-12-19", 5000))
            .listing("http://forum.test/beta", item("b1", "2025-12-18", 20))
            .content("http://forum.test/posts/a1.html", "long post");

        TriggerResult started = harness.trigger.trigger(false);
        List<PhaseResult> results = harness.drain();

        assertThat(results).allMatch(PhaseResult::success);
        assertThat(harness.deliveriesTo(ContinuationPublisher.DISCOVER_PATH)).isEqualTo(2);
        assertThat(harness.deliveriesTo(ContinuationPublisher.FETCH_PATH)).isEqualTo(1);
        assertThat(harness.deliveriesTo(ContinuationPublisher.FINALIZE_PATH)).isEqualTo(1);
        assertThat(harness.scraper.fetchCalls()).containsExactly("http://forum.test/posts/a1.html");

        Job job = harness.jobs.require(started.jobId());
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETE);
        assertThat(job.discoveryTargetsComplete()).isEqualTo(2);
        assertThat(job.fetchTargetsTotal()).isEqualTo(1);
        assertThat(job.fetchTargetsComplete()).isEqualTo(1);
        assertThat(job.totalNewItems()).isEqualTo(2);
        assertThat(job.notificationSent()).isTrue();

        List<ItemGroup> digest = harness.sender.sent().get(0);
        assertThat(digest).extracting(ItemGroup::groupKey).containsExactly("alpha", "beta");
        assertThat(ItemGroups.totalItems(digest)).isEqualTo(2);
        assertThat(harness.jobs.findItem(job.id(), "a1")).map(Item::status).contains(ItemStatus.FETCHED);
        assertThat(harness.jobs.findItem(job.id(), "b1")).map(Item::status).contains(ItemStatus.SKIPPED);
        assertThat(harness.ledger.seenCount()).isEqualTo(2);
    }

    @Test
    void secondRunSkipsLedgeredItems() {
        TrackerHarness harness = new TrackerHarness().source("alpha", "http://forum.test/alpha");
        harness.scraper.listing("http://forum.test/alpha", item("a1", "2025-12-19", 5000));
        harness.trigger.trigger(false);
        harness.drain();

        harness.clock.advance(Duration.ofHours(1));
        harness.scraper.listing("http://forum.test/alpha",
            item("a1", "2025-12-19", 5000), item("a2", "2025-12-20", 5000));
        TriggerResult second = harness.trigger.trigger(false);
        harness.drain();

        assertThat(harness.jobs.allItems(second.jobId())).extracting(Item::id).containsExactly("a2");
        assertThat(harness.sender.sent()).hasSize(2);
        assertThat(harness.ledger.seenCount()).isEqualTo(2);
    }

    @Test
    void duplicateDeliveriesAreHarmless() {
        TrackerHarness harness = new TrackerHarness().source("alpha", "http://forum.test/alpha");
        harness.scraper.listing("http://forum.test/alpha", item("a1", "2025-12-19", 5000));
        harness.trigger.trigger(false);

        while (harness.dispatcher.hasPending()) {
            RecordingDispatcher.Published next = harness.dispatcher.poll();
            harness.deliver(next);
            harness.deliver(next);
        }

        assertThat(harness.sender.sent()).hasSize(1);
        assertThat(harness.jobs.findActiveOrLast()).map(Job::status).contains(JobStatus.COMPLETE);
    }
}
