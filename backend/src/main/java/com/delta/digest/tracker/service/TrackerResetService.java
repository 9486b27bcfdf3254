package com.delta.digest.tracker.service;

import com.delta.digest.tracker.model.ResetResult;
import com.delta.digest.tracker.persistence.DedupLedger;
import com.delta.digest.tracker.persistence.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TrackerResetService {
    private static final Logger log = LoggerFactory.getLogger(TrackerResetService.class);

    private final JobRecordStore jobs;
    private final DedupLedger ledger;

    public TrackerResetService(JobRecordStore jobs, DedupLedger ledger) {
        this.jobs = jobs;
        this.ledger = ledger;
    }

    public ResetResult reset(boolean full) {
        long deleted = jobs.deleteAll();
        if (full) {
            deleted += ledger.clear();
        }
        log.warn("Reset removed {} keys (ledger cleared={})", deleted, full);
        String message = full ? "Jobs and ledger cleared" : "Jobs cleared";
        return new ResetResult(true, message, deleted, full);
    }
}
