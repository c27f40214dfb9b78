package com.onalog.discovery.lead.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lets the scheduler hold a background fill while a foreground job runs. A paused gate reopens by itself after
 * the failsafe delay so a lost resume can never strand a job.
 */
public class PauseGate {
    private static final Logger log = LoggerFactory.getLogger(PauseGate.class);

    private final long searchJobId;
    private final ScheduledExecutorService timer;
    private final Duration failsafe;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition resumed = lock.newCondition();
    private boolean paused;
    private ScheduledFuture<?> failsafeTask;

    public PauseGate(long searchJobId, ScheduledExecutorService timer, Duration failsafe) {
        this.searchJobId = searchJobId;
        this.timer = timer;
        this.failsafe = failsafe;
    }

    public void pause() {
        lock.lock();
        try {
            paused = true;
            cancelFailsafe();
            failsafeTask = timer.schedule(this::failsafeResume, failsafe.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            cancelFailsafe();
            resumed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while paused. Returns false if the waiting thread was interrupted.
     */
    public boolean awaitIfPaused() {
        lock.lock();
        try {
            while (paused) {
                resumed.await();
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void failsafeResume() {
        if (isPaused()) {
            log.warn("Background fill for job {} still paused after {}; resuming", searchJobId, failsafe);
            resume();
        }
    }

    private void cancelFailsafe() {
        if (failsafeTask != null) {
            failsafeTask.cancel(false);
            failsafeTask = null;
        }
    }
}
