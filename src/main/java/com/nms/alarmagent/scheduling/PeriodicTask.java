package com.nms.alarmagent.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A named fixed-rate task with an explicit cancellation handle.
 *
 * The first run fires one interval after {@link #start(Duration)}. Exceptions thrown by the body
 * are logged and swallowed so that one failed run never cancels the schedule.
 * {@link #cancel(Duration)} stops future runs and waits for a run that is already in flight;
 * a run that starts after the cancel does nothing.
 */
@Slf4j
public class PeriodicTask {

    private final String name;
    private final Runnable body;
    private final TaskScheduler scheduler;
    private final Clock clock;

    // held for the duration of a run, so cancel() can join it
    private final ReentrantLock runLock = new ReentrantLock();

    private volatile ScheduledFuture<?> future;
    // a run already handed to the scheduler may start after cancel() returns
    private volatile boolean cancelled;
    private volatile Instant firstRunAt;

    public PeriodicTask(String name, Runnable body, TaskScheduler scheduler, Clock clock) {
        this.name = name;
        this.body = body;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public synchronized void start(Duration interval) {
        if (isScheduled()) {
            log.warn("Periodic task '{}' is already running", name);
            return;
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval of '" + name + "' must be positive: " + interval);
        }
        cancelled = false;
        firstRunAt = clock.instant().plus(interval);
        future = scheduler.scheduleAtFixedRate(this::runOnce, firstRunAt, interval);
        log.info("Periodic task '{}' scheduled every {} (first run at {})", name, interval, firstRunAt);
    }

    /**
     * Cancel future runs and wait up to {@code timeout} for an in-flight run to finish.
     *
     * @return true if no run is in flight any more
     */
    public synchronized boolean cancel(Duration timeout) {
        ScheduledFuture<?> current = future;
        if (current == null) {
            return true;
        }
        cancelled = true;
        current.cancel(false);
        future = null;
        try {
            if (runLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                runLock.unlock();
                log.info("Periodic task '{}' cancelled", name);
                return true;
            }
            log.warn("Periodic task '{}' still running after {}", name, timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isScheduled() {
        ScheduledFuture<?> current = future;
        return current != null && !current.isCancelled();
    }

    public Instant getFirstRunAt() {
        return firstRunAt;
    }

    void runOnce() {
        runLock.lock();
        try {
            if (cancelled) {
                log.debug("Periodic task '{}' was cancelled, skipping run", name);
                return;
            }
            body.run();
        } catch (RuntimeException e) {
            log.error("Periodic task '{}' failed, will retry on next cycle", name, e);
        } finally {
            runLock.unlock();
        }
    }
}
