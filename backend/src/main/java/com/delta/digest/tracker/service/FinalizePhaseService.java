package com.delta.digest.tracker.service;

import com.delta.digest.tracker.model.FinalizeRequest;
import com.delta.digest.tracker.model.Item;
import com.delta.digest.tracker.model.ItemGroup;
import com.delta.digest.tracker.model.Job;
import com.delta.digest.tracker.model.JobStatus;
import com.delta.digest.tracker.model.NotificationResult;
import com.delta.digest.tracker.model.PhaseResult;
import com.delta.digest.tracker.notify.ItemGroups;
import com.delta.digest.tracker.notify.NotificationSender;
import com.delta.digest.tracker.persistence.DedupLedger;
import com.delta.digest.tracker.persistence.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sends the digest once and records every item of the job in the ledger, whether or not the send
 * succeeded. A failed send is not retried; those items will not be offered again.
 */
@Service
public class FinalizePhaseService {
    private static final Logger log = LoggerFactory.getLogger(FinalizePhaseService.class);

    private final JobRecordStore jobs;
    private final DedupLedger ledger;
    private final NotificationSender sender;
    private final Clock clock;

    public FinalizePhaseService(JobRecordStore jobs, DedupLedger ledger, NotificationSender sender, Clock clock) {
        this.jobs = jobs;
        this.ledger = ledger;
        this.sender = sender;
        this.clock = clock;
    }

    public PhaseResult finalizeJob(FinalizeRequest request) {
        String jobId = request.jobId();
        Job job = jobs.require(jobId);
        if (job.status() != JobStatus.FINALIZING) {
            log.info("Ignoring finalize for job {} in status {}", jobId, job.status().wireName());
            return PhaseResult.stale(jobId, null, job.status());
        }
        try {
            return complete(jobId);
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Finalize failed for job {}", jobId, e);
            jobs.fail(jobId, message);
            throw new BatchFailedException(jobId, null, message, e);
        }
    }

    private PhaseResult complete(String jobId) {
        List<Item> items = jobs.allItems(jobId);
        if (items.isEmpty()) {
            ledger.recordRun(clock.instant());
            Optional<Job> completed = jobs.transition(jobId, JobStatus.FINALIZING, JobStatus.COMPLETE,
                j -> j.withNotification(false, null));
            if (completed.isEmpty()) {
                return PhaseResult.stale(jobId, null, jobs.require(jobId).status());
            }
            log.info("Job {} finished with no new items", jobId);
            return PhaseResult.finalized(jobId, 0, false, null);
        }

        List<ItemGroup> groups = ItemGroups.group(items);
        NotificationResult notification = send(jobId, groups);

        List<String> ids = new ArrayList<>(items.size());
        for (Item item : items) {
            ids.add(item.id());
        }
        long added = ledger.markSeen(ids);
        ledger.recordRun(clock.instant());

        Optional<Job> completed = jobs.transition(jobId, JobStatus.FINALIZING, JobStatus.COMPLETE,
            j -> j.withNotification(notification.success(), notification.error()));
        if (completed.isEmpty()) {
            return PhaseResult.stale(jobId, null, jobs.require(jobId).status());
        }
        log.info("Job {} finalized: {} items in {} groups, {} newly ledgered, notification sent={}",
            jobId, items.size(), groups.size(), added, notification.success());
        return PhaseResult.finalized(jobId, items.size(), notification.success(), notification.error());
    }

    private NotificationResult send(String jobId, List<ItemGroup> groups) {
        try {
            NotificationResult result = sender.send(groups);
            return result == null ? NotificationResult.failed("No result from notification sender") : result;
        } catch (RuntimeException e) {
            log.warn("Notification for job {} threw: {}", jobId, e.getMessage());
            return NotificationResult.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }
}
