package it.dicom.service;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public class AssociationTimers {

    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> artim;
    private ScheduledFuture<?> idle;
    private boolean cancelled;

    public AssociationTimers(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public synchronized void startArtim(long timeoutMillis, Runnable onExpiry) {
        artim = reschedule(artim, timeoutMillis, onExpiry);
    }

    public synchronized void cancelArtim() {
        artim = cancel(artim);
    }

    public synchronized void restartIdle(long timeoutMillis, Runnable onExpiry) {
        idle = reschedule(idle, timeoutMillis, onExpiry);
    }

    public synchronized void cancelIdle() {
        idle = cancel(idle);
    }

    public synchronized void cancelAll() {
        cancelled = true;
        artim = cancel(artim);
        idle = cancel(idle);
    }

    public synchronized boolean isArtimRunning() {
        return artim != null && !artim.isDone();
    }

    public synchronized boolean isIdleRunning() {
        return idle != null && !idle.isDone();
    }

    private ScheduledFuture<?> reschedule(ScheduledFuture<?> current, long timeoutMillis, Runnable onExpiry) {
        cancel(current);
        if (cancelled || timeoutMillis <= 0) {
            return null;
        }
        return scheduler.schedule(onExpiry, timeoutMillis, TimeUnit.MILLISECONDS);
    }

    private static ScheduledFuture<?> cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
        return null;
    }
}
