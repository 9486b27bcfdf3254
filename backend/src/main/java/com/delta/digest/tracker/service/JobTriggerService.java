package com.delta.digest.tracker.service;

import com.delta.digest.tracker.dispatch.ContinuationPublisher;
import com.delta.digest.tracker.dispatch.DispatchException;
import com.delta.digest.tracker.model.DiscoveryTarget;
import com.delta.digest.tracker.model.Job;
import com.delta.digest.tracker.model.TriggerResult;
import com.delta.digest.tracker.persistence.BatchQueues;
import com.delta.digest.tracker.persistence.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class JobTriggerService {
    private static final Logger log = LoggerFactory.getLogger(JobTriggerService.class);

    private final JobRecordStore jobs;
    private final BatchQueues queues;
    private final TrackedSourceCatalog catalog;
    private final StuckJobReaper reaper;
    private final ContinuationPublisher publisher;

    public JobTriggerService(
        JobRecordStore jobs,
        BatchQueues queues,
        TrackedSourceCatalog catalog,
        StuckJobReaper reaper,
        ContinuationPublisher publisher
    ) {
        this.jobs = jobs;
        this.queues = queues;
        this.catalog = catalog;
        this.reaper = reaper;
        this.publisher = publisher;
    }

    public TriggerResult trigger(boolean force) {
        String reapedJobId = null;
        Optional<Job> active = jobs.findActive();
        if (active.isPresent() && !active.get().status().isTerminal()) {
            Job existing = active.get();
            if (force) {
                log.warn("Forced trigger abandons job {} in status {}", existing.id(), existing.status().wireName());
            } else if (reaper.isStuck(existing)) {
                reaper.reap(existing);
                reapedJobId = existing.id();
            } else {
                log.info("Job {} still {}, not starting another", existing.id(), existing.status().wireName());
                return TriggerResult.alreadyRunning(existing);
            }
        }

        List<DiscoveryTarget> targets = catalog.targets();
        Job job = jobs.create(targets.size());
        queues.enqueueDiscoveryTargets(job.id(), targets);
        log.info("Created job {} with {} discovery targets", job.id(), targets.size());

        String messageId;
        try {
            messageId = publisher.discover(job.id(), 0);
        } catch (DispatchException e) {
            jobs.fail(job.id(), "Failed to dispatch first batch: " + e.getMessage());
            throw e;
        }
        return TriggerResult.started(job, reapedJobId, messageId);
    }
}
