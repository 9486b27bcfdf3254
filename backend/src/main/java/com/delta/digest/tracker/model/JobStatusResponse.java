package com.delta.digest.tracker.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    boolean success,
    String message,
    Job job,
    Long pendingDiscoveryTargets,
    Long pendingFetchTargets,
    Integer itemCount,
    List<Item> items,
    LedgerInfo ledger
) {}
