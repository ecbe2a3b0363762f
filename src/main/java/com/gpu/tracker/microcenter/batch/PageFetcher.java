package com.gpu.tracker.microcenter.batch;

/**
 * Returns the rendered markup of one listing page. Implementations fail with
 * {@link PageFetchException} when the page does not load, or loads without any
 * product on it, within their timeout.
 */
public interface PageFetcher {
    String fetch(String url) throws PageFetchException;
}
