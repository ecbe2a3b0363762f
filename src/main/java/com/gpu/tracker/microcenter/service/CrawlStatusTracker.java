package com.gpu.tracker.microcenter.service;

import com.gpu.tracker.microcenter.model.CrawlPhase;
import com.gpu.tracker.microcenter.model.CrawlStatusView;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Process-wide crawl state. Entry into RUNNING is a single compare-and-set,
 * so at most one crawl runs at a time across all stores. Updates made while
 * not running are ignored.
 */
@Component
public class CrawlStatusTracker {
    private final AtomicReference<CrawlState> state = new AtomicReference<>(CrawlState.idle());
    private final Clock clock;

    public CrawlStatusTracker() {
        this(Clock.systemDefaultZone());
    }

    CrawlStatusTracker(Clock clock) {
        this.clock = clock;
    }

    public boolean tryStart(String currentStore, String message) {
        while (true) {
            CrawlState current = state.get();
            if (current.phase() == CrawlPhase.RUNNING) {
                return false;
            }
            CrawlState next = new CrawlState(CrawlPhase.RUNNING, currentStore, message, now(), null, 0, 0);
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    public void progress(String currentStore, String message) {
        updateWhileRunning(s -> new CrawlState(s.phase(), currentStore, message, s.startedAt(), null,
                s.pagesProcessed(), s.itemsRecorded()));
    }

    public void pageCompleted(int itemsRecorded) {
        updateWhileRunning(s -> new CrawlState(s.phase(), s.currentStore(), s.message(), s.startedAt(), null,
                s.pagesProcessed() + 1, s.itemsRecorded() + itemsRecorded));
    }

    public void complete() {
        updateWhileRunning(s -> new CrawlState(CrawlPhase.IDLE, null,
                s.message() == null ? "Crawl finished" : s.message(), s.startedAt(), now(),
                s.pagesProcessed(), s.itemsRecorded()));
    }

    public void fail(String message) {
        updateWhileRunning(s -> new CrawlState(CrawlPhase.FAILED, null, message, s.startedAt(), now(),
                s.pagesProcessed(), s.itemsRecorded()));
    }

    public boolean isRunning() {
        return state.get().phase() == CrawlPhase.RUNNING;
    }

    public CrawlStatusView status() {
        CrawlState s = state.get();
        return new CrawlStatusView(
                s.phase() == CrawlPhase.RUNNING,
                s.phase(),
                s.currentStore(),
                s.message(),
                s.startedAt(),
                s.endedAt(),
                s.pagesProcessed(),
                s.itemsRecorded()
        );
    }

    private void updateWhileRunning(UnaryOperator<CrawlState> update) {
        state.updateAndGet(s -> s.phase() == CrawlPhase.RUNNING ? update.apply(s) : s);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private record CrawlState(
            CrawlPhase phase,
            String currentStore,
            String message,
            LocalDateTime startedAt,
            LocalDateTime endedAt,
            int pagesProcessed,
            long itemsRecorded
    ) {
        static CrawlState idle() {
            return new CrawlState(CrawlPhase.IDLE, null, "Idle", null, null, 0, 0);
        }
    }
}
