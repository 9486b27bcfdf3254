package com.delta.digest.tracker.persistence;

public class StoreSerializationException extends RuntimeException {
    public StoreSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
