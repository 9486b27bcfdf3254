package com.delta.digest.tracker.security;

public enum RequestOrigin {
    LOCAL_BYPASS,
    TRIGGER_SECRET,
    UNSECURED_DEV,
    SIGNED_DELIVERY
}
