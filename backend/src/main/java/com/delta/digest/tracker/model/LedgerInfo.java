package com.delta.digest.tracker.model;

import java.time.Instant;

public record LedgerInfo(Instant lastRun, long seenCount) {}
