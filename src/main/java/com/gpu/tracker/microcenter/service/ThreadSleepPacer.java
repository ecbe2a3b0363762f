package com.gpu.tracker.microcenter.service;

import org.springframework.stereotype.Component;

@Component
public class ThreadSleepPacer implements Pacer {
    @Override
    public void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
