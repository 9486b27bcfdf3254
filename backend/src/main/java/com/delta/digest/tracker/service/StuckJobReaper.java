package com.delta.digest.tracker.service;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.model.Job;
import com.delta.digest.tracker.persistence.JobRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

@Service
public class StuckJobReaper {
    public static final String STUCK_MESSAGE = "Job timed out - marked as stuck";

    private static final Logger log = LoggerFactory.getLogger(StuckJobReaper.class);

    private final JobRecordStore jobs;
    private final TrackerProperties properties;
    private final Clock clock;

    public StuckJobReaper(JobRecordStore jobs, TrackerProperties properties, Clock clock) {
        this.jobs = jobs;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isStuck(Job job) {
        if (job == null || job.status().isTerminal() || job.updatedAt() == null) {
            return false;
        }
        Duration idle = Duration.between(job.updatedAt(), clock.instant());
        return idle.compareTo(Duration.ofMinutes(properties.getJob().getTimeoutMinutes())) > 0;
    }

    public Optional<Job> reap(Job job) {
        log.warn("Job {} stuck in {} since {}, marking failed", job.id(), job.status().wireName(), job.updatedAt());
        return jobs.fail(job.id(), STUCK_MESSAGE);
    }
}
