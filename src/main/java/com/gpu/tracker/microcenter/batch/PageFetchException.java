package com.gpu.tracker.microcenter.batch;

public class PageFetchException extends Exception {
    public PageFetchException(String message) {
        super(message);
    }

    public PageFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
