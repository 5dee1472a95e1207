package com.crisisnavigator.collectors.api;

public class FeedFetchException extends Exception {
    public FeedFetchException(String message) {
        super(message);
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
