package com.delta.digest.tracker.model;

public record FinalizeRequest(String jobId) {}
