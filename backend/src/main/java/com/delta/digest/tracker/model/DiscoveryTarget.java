package com.delta.digest.tracker.model;

public record DiscoveryTarget(String sourceName, String sourceUrl) {}
