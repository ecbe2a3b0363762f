package com.gpu.tracker.microcenter.service;

/**
 * Politeness delay between requests to the retailer.
 */
public interface Pacer {
    void pause(long millis) throws InterruptedException;
}
