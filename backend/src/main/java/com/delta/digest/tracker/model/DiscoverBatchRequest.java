package com.delta.digest.tracker.model;

public record DiscoverBatchRequest(String jobId, int batchIndex) {}
