package com.gpu.tracker.microcenter.service;

import com.gpu.tracker.microcenter.model.CrawlStatusView;

public class CrawlBusyException extends RuntimeException {
    private final CrawlStatusView status;

    public CrawlBusyException(CrawlStatusView status) {
        super("A crawl is already running" + (status.currentStore() == null ? "" : " (" + status.currentStore() + ")"));
        this.status = status;
    }

    public CrawlStatusView getStatus() {
        return status;
    }
}
