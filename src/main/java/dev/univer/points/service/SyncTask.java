package dev.univer.points.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Handle of the background reconciliation loop. The delay before each run is read after the
 * previous one completes, so interval changes apply from the next tick. Stopping cancels the
 * schedule but lets a running pass finish.
 */
@Slf4j
public class SyncTask {
    public enum State { STOPPED, RUNNING }

    private final TaskScheduler scheduler;
    private final Runnable body;
    private final Supplier<Duration> interval;
    private final Duration errorBackoff;

    private ScheduledFuture<?> future;
    private State state = State.STOPPED;
    private volatile boolean lastRunFailed;

    public SyncTask(TaskScheduler scheduler, Runnable body, Supplier<Duration> interval, Duration errorBackoff) {
        this.scheduler = scheduler;
        this.body = body;
        this.interval = interval;
        this.errorBackoff = errorBackoff;
    }

    /** @return {@code false} if the loop was already running */
    public synchronized boolean start() {
        if (state == State.RUNNING) return false;
        future = scheduler.schedule(this::runOnce, trigger());
        state = State.RUNNING;
        log.info("Background sync started");
        return true;
    }

    /** @return {@code false} if the loop was not running */
    public synchronized boolean stop() {
        if (state == State.STOPPED) return false;
        if (future != null) future.cancel(false);
        future = null;
        state = State.STOPPED;
        log.info("Background sync stopped");
        return true;
    }

    public synchronized State getState() {
        return state;
    }

    private void runOnce() {
        try {
            body.run();
            lastRunFailed = false;
        } catch (RuntimeException e) {
            lastRunFailed = true;
            log.error("Background sync tick failed, retrying in {}", errorBackoff, e);
        }
    }

    private Trigger trigger() {
        return ctx -> {
            Instant last = ctx.lastCompletion();
            Duration delay = lastRunFailed ? errorBackoff : interval.get();
            return (last == null ? Instant.now() : last).plus(delay);
        };
    }
}
