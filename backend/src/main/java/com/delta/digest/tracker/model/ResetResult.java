package com.delta.digest.tracker.model;

public record ResetResult(boolean success, String message, long deletedKeys, boolean ledgerCleared) {}
