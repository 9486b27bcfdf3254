package com.delta.digest.tracker.service;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.dispatch.ContinuationPublisher;
import com.delta.digest.tracker.model.FetchBatchRequest;
import com.delta.digest.tracker.model.Item;
import com.delta.digest.tracker.model.Job;
import com.delta.digest.tracker.model.JobStatus;
import com.delta.digest.tracker.model.PhaseResult;
import com.delta.digest.tracker.persistence.BatchQueues;
import com.delta.digest.tracker.persistence.JobRecordStore;
import com.delta.digest.tracker.scrape.SourceScraper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

@Service
public class FetchPhaseService {
    private static final Logger log = LoggerFactory.getLogger(FetchPhaseService.class);

    private final JobRecordStore jobs;
    private final BatchQueues queues;
    private final SourceScraper scraper;
    private final ContinuationPublisher publisher;
    private final BatchPacer pacer;
    private final TrackerProperties properties;

    public FetchPhaseService(
        JobRecordStore jobs,
        BatchQueues queues,
        SourceScraper scraper,
        ContinuationPublisher publisher,
        BatchPacer pacer,
        TrackerProperties properties
    ) {
        this.jobs = jobs;
        this.queues = queues;
        this.scraper = scraper;
        this.publisher = publisher;
        this.pacer = pacer;
        this.properties = properties;
    }

    public PhaseResult fetch(FetchBatchRequest request) {
        String jobId = request.jobId();
        int batchIndex = request.batchIndex();
        Job job = jobs.require(jobId);
        if (job.status() != JobStatus.FETCHING) {
            log.info("Ignoring fetch batch {} for job {} in status {}", batchIndex, jobId, job.status().wireName());
            return PhaseResult.stale(jobId, batchIndex, job.status());
        }
        try {
            return processBatch(jobId, batchIndex);
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Fetch batch {} failed for job {}", batchIndex, jobId, e);
            jobs.fail(jobId, message);
            throw new BatchFailedException(jobId, batchIndex, message, e);
        }
    }

    private PhaseResult processBatch(String jobId, int batchIndex) {
        List<String> itemIds = queues.dequeueFetchBatch(jobId, properties.getJob().getFetchBatchSize());
        if (itemIds.isEmpty()) {
            if (queues.fetchQueueEmpty(jobId)) {
                advance(jobId);
            }
            return PhaseResult.queueEmpty(jobId, batchIndex);
        }
        log.info("Fetch batch {} for job {}: {} items", batchIndex, jobId, itemIds.size());

        int fetched = 0;
        int skipped = 0;
        for (int i = 0; i < itemIds.size(); i++) {
            String itemId = itemIds.get(i);
            pacer.beforeCall(i);
            Optional<Item> stored = jobs.findItem(jobId, itemId);
            if (stored.isEmpty()) {
                log.warn("Item {} not found in job {}", itemId, jobId);
                continue;
            }
            Item item = stored.get();
            try {
                String content = scraper.fetchContent(item.sourceUrl());
                jobs.updateItem(jobId, item.fetched(content));
                fetched++;
                log.debug("Fetched {} chars for item {}", content == null ? 0 : content.length(), itemId);
            } catch (IOException | RuntimeException e) {
                String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("Failed to fetch item {} from {}: {}", itemId, item.sourceUrl(), reason);
                jobs.updateItem(jobId, item.skipped(reason));
                skipped++;
            }
        }

        jobs.update(jobId, j -> j.withFetchProgress(itemIds.size()));

        if (queues.fetchQueueEmpty(jobId)) {
            advance(jobId);
        } else {
            publisher.fetch(jobId, batchIndex + 1);
        }
        return PhaseResult.fetched(jobId, batchIndex, itemIds.size(), fetched, skipped);
    }

    private void advance(String jobId) {
        if (jobs.transition(jobId, JobStatus.FETCHING, JobStatus.FINALIZING).isPresent()) {
            publisher.finalizeJob(jobId);
        }
    }
}
