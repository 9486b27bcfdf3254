package com.delta.digest.tracker.service;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.dispatch.ContinuationPublisher;
import com.delta.digest.tracker.model.DiscoverBatchRequest;
import com.delta.digest.tracker.model.DiscoveredItem;
import com.delta.digest.tracker.model.DiscoveryTarget;
import com.delta.digest.tracker.model.Item;
import com.delta.digest.tracker.model.ItemStatus;
import com.delta.digest.tracker.model.Job;
import com.delta.digest.tracker.model.JobStatus;
import com.delta.digest.tracker.model.PhaseResult;
import com.delta.digest.tracker.persistence.BatchQueues;
import com.delta.digest.tracker.persistence.DedupLedger;
import com.delta.digest.tracker.persistence.JobRecordStore;
import com.delta.digest.tracker.scrape.SourceScraper;
import com.delta.digest.tracker.util.ItemFilters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class DiscoverPhaseService {
    private static final Logger log = LoggerFactory.getLogger(DiscoverPhaseService.class);

    private final JobRecordStore jobs;
    private final BatchQueues queues;
    private final DedupLedger ledger;
    private final SourceScraper scraper;
    private final ContinuationPublisher publisher;
    private final BatchPacer pacer;
    private final TrackerProperties properties;
    private final Clock clock;

    public DiscoverPhaseService(
        JobRecordStore jobs,
        BatchQueues queues,
        DedupLedger ledger,
        SourceScraper scraper,
        ContinuationPublisher publisher,
        BatchPacer pacer,
        TrackerProperties properties,
        Clock clock
    ) {
        this.jobs = jobs;
        this.queues = queues;
        this.ledger = ledger;
        this.scraper = scraper;
        this.publisher = publisher;
        this.pacer = pacer;
        this.properties = properties;
        this.clock = clock;
    }

    public PhaseResult discover(DiscoverBatchRequest request) {
        String jobId = request.jobId();
        int batchIndex = request.batchIndex();
        Job job = jobs.require(jobId);
        if (job.status() != JobStatus.DISCOVERING) {
            log.info("Ignoring discover batch {} for job {} in status {}", batchIndex, jobId, job.status().wireName());
            return PhaseResult.stale(jobId, batchIndex, job.status());
        }
        try {
            return processBatch(job, batchIndex);
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Discover batch {} failed for job {}", batchIndex, jobId, e);
            jobs.fail(jobId, message);
            throw new BatchFailedException(jobId, batchIndex, message, e);
        }
    }

    private PhaseResult processBatch(Job job, int batchIndex) {
        String jobId = job.id();
        TrackerProperties.Job config = properties.getJob();
        List<DiscoveryTarget> batch = queues.dequeueDiscoveryBatch(jobId, config.getDiscoveryBatchSize());
        if (batch.isEmpty()) {
            if (queues.discoveryQueueEmpty(jobId)) {
                advance(jobId);
            }
            return PhaseResult.queueEmpty(jobId, batchIndex);
        }
        log.info("Discover batch {} for job {}: {} targets", batchIndex, jobId, batch.size());

        LocalDate today = LocalDate.now(clock.withZone(ItemFilters.zoneOrUtc(config.getZone())));
        Set<String> takenInBatch = new HashSet<>();
        List<Item> newItems = new ArrayList<>();
        List<String> fetchTargets = new ArrayList<>();
        int nextOrder = job.totalNewItems();

        for (int i = 0; i < batch.size(); i++) {
            DiscoveryTarget target = batch.get(i);
            pacer.beforeCall(i);
            List<DiscoveredItem> listed;
            try {
                listed = scraper.listItems(target.sourceUrl());
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to list {} ({}): {}", target.sourceName(), target.sourceUrl(), e.getMessage());
                continue;
            }
            List<DiscoveredItem> recent = ItemFilters.publishedWithin(
                ItemFilters.dedupe(listed),
                today,
                config.getMaxAgeDays()
            );
            int accepted = 0;
            for (DiscoveredItem candidate : recent) {
                if (takenInBatch.contains(candidate.id())
                    || ledger.isSeen(candidate.id())
                    || jobs.containsItem(jobId, candidate.id())) {
                    continue;
                }
                takenInBatch.add(candidate.id());
                boolean fetchable = candidate.sizeHint() >= config.getMinSizeForContent();
                newItems.add(Item.discovered(
                    candidate,
                    target.sourceName(),
                    nextOrder++,
                    fetchable ? ItemStatus.PENDING : ItemStatus.SKIPPED
                ));
                if (fetchable) {
                    fetchTargets.add(candidate.id());
                }
                accepted++;
            }
            log.info("Source {}: {} listed, {} recent, {} new", target.sourceName(), listed.size(), recent.size(), accepted);
        }

        jobs.addItems(jobId, newItems);
        queues.enqueueFetchTargets(jobId, fetchTargets);
        jobs.update(jobId, j -> j.withDiscoveryProgress(batch.size(), fetchTargets.size(), newItems.size()));

        if (queues.discoveryQueueEmpty(jobId)) {
            advance(jobId);
        } else {
            publisher.discover(jobId, batchIndex + 1);
        }
        return PhaseResult.discovered(jobId, batchIndex, batch.size(), newItems.size(), fetchTargets.size());
    }

    private void advance(String jobId) {
        Job current = jobs.require(jobId);
        if (current.fetchTargetsTotal() > 0) {
            if (jobs.transition(jobId, JobStatus.DISCOVERING, JobStatus.FETCHING).isPresent()) {
                publisher.fetch(jobId, 0);
            }
        } else if (jobs.transition(jobId, JobStatus.DISCOVERING, JobStatus.FINALIZING).isPresent()) {
            publisher.finalizeJob(jobId);
        }
    }
}
