package com.gpu.tracker.microcenter.model;

public enum CrawlPhase {
    IDLE,
    RUNNING,
    FAILED
}
