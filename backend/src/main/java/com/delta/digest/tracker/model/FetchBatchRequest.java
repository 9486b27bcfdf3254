package com.delta.digest.tracker.model;

public record FetchBatchRequest(String jobId, int batchIndex) {}
