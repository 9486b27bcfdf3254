package com.delta.digest.tracker.service;

import com.delta.digest.tracker.model.Item;
import com.delta.digest.tracker.model.Job;
import com.delta.digest.tracker.notify.DigestRenderer;
import com.delta.digest.tracker.notify.ItemGroups;
import com.delta.digest.tracker.persistence.JobRecordStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Service
public class DigestPreviewService {
    private final JobRecordStore jobs;
    private final DigestRenderer renderer;
    private final Clock clock;

    public DigestPreviewService(JobRecordStore jobs, DigestRenderer renderer, Clock clock) {
        this.jobs = jobs;
        this.renderer = renderer;
        this.clock = clock;
    }

    public String preview(String jobId) {
        Optional<Job> job = jobId == null || jobId.isBlank()
            ? jobs.findActiveOrLast()
            : Optional.of(jobs.require(jobId));
        if (job.isEmpty()) {
            return renderer.renderPreview(List.of(), null, null, clock.instant());
        }
        List<Item> items = jobs.allItems(job.get().id());
        return renderer.renderPreview(ItemGroups.group(items), job.get().id(), job.get().status(), clock.instant());
    }
}
