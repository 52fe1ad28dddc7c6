package it.dicom.service;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AssociationTimersTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final AssociationTimers timers = new AssociationTimers(scheduler);

    @AfterEach
    void shutdown() {
        scheduler.shutdownNow();
    }

    @Test
    void shouldFireArtimAfterTimeout() throws InterruptedException {
        CountDownLatch expired = new CountDownLatch(1);

        timers.startArtim(50, expired::countDown);

        assertTrue(expired.await(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldNotFireCancelledTimer() throws InterruptedException {
        CountDownLatch expired = new CountDownLatch(1);
        timers.startArtim(100, expired::countDown);

        timers.cancelArtim();

        assertFalse(expired.await(300, TimeUnit.MILLISECONDS));
        assertFalse(timers.isArtimRunning());
    }

    @Test
    void shouldPostponeIdleTimerOnRestart() throws InterruptedException {
        CountDownLatch first = new CountDownLatch(1);
        CountDownLatch second = new CountDownLatch(1);
        timers.restartIdle(150, first::countDown);

        timers.restartIdle(150, second::countDown);

        assertTrue(second.await(2, TimeUnit.SECONDS));
        assertFalse(first.await(50, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldIgnoreSchedulingAfterCancelAll() {
        timers.cancelAll();

        timers.startArtim(1000, () -> { });
        timers.restartIdle(1000, () -> { });

        assertFalse(timers.isArtimRunning());
        assertFalse(timers.isIdleRunning());
    }

    @Test
    void shouldTreatZeroTimeoutAsDisabled() {
        timers.restartIdle(0, () -> { });

        assertFalse(timers.isIdleRunning());
    }
}
