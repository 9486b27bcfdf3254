package com.delta.digest.tracker.service;

import com.delta.digest.tracker.model.Job;
import com.delta.digest.tracker.model.JobStatusResponse;
import com.delta.digest.tracker.model.LedgerInfo;
import com.delta.digest.tracker.persistence.BatchQueues;
import com.delta.digest.tracker.persistence.DedupLedger;
import com.delta.digest.tracker.persistence.JobRecordStore;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class JobStatusService {
    private final JobRecordStore jobs;
    private final BatchQueues queues;
    private final DedupLedger ledger;

    public JobStatusService(JobRecordStore jobs, BatchQueues queues, DedupLedger ledger) {
        this.jobs = jobs;
        this.queues = queues;
        this.ledger = ledger;
    }

    public JobStatusResponse status(String jobId, boolean includeItems) {
        LedgerInfo ledgerInfo = new LedgerInfo(ledger.lastRun().orElse(null), ledger.seenCount());
        Optional<Job> job = jobId == null || jobId.isBlank()
            ? jobs.findActiveOrLast()
            : Optional.of(jobs.require(jobId));
        if (job.isEmpty()) {
            return new JobStatusResponse(true, "No job found", null, null, null, null, null, ledgerInfo);
        }
        String id = job.get().id();
        return new JobStatusResponse(
            true,
            null,
            job.get(),
            queues.pendingDiscovery(id),
            queues.pendingFetch(id),
            jobs.itemCount(id),
            includeItems ? jobs.allItems(id) : null,
            ledgerInfo
        );
    }
}
