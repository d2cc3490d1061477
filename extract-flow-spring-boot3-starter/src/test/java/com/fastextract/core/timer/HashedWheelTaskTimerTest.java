package com.fastextract.core.timer;

import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class HashedWheelTaskTimerTest {

    private HashedWheelTaskTimer timer;
    private boolean stopped;

    @BeforeEach
    void setUp() {
        timer = new HashedWheelTaskTimer(new HashedWheelTimer(10, TimeUnit.MILLISECONDS));
    }

    @AfterEach
    void tearDown() {
        if (!stopped) {
            timer.stop();
        }
    }

    @Test
    void delay_completesAfterRequestedTime() throws Exception {
        long start = System.nanoTime();

        timer.delay(WheelTask.Kind.RETRY_BACKOFF, 50).get(2, TimeUnit.SECONDS);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(40);
    }

    @Test
    void delay_nonPositive_completesImmediately() {
        assertThat(timer.delay(WheelTask.Kind.BATCH_PAUSE, 0)).isDone();
    }

    @Test
    void schedule_runsTaskUnlessCancelled() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        AtomicBoolean cancelledRan = new AtomicBoolean();

        timer.schedule(WheelTask.Kind.DEADLINE, fired::countDown, 20);
        TaskTimer.ScheduledHandle handle = timer.schedule(WheelTask.Kind.DEADLINE, () -> cancelledRan.set(true), 20);
        assertThat(handle.cancel()).isTrue();

        assertThat(fired.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(50);
        assertThat(cancelledRan).isFalse();
    }

    @Test
    void stop_cancelsPendingWaitsAndReportsKinds() {
        CompletableFuture<Void> backoff = timer.delay(WheelTask.Kind.RETRY_BACKOFF, 60_000);
        timer.delay(WheelTask.Kind.RETRY_BACKOFF, 60_000);
        timer.schedule(WheelTask.Kind.DEADLINE, () -> { }, 60_000);

        Map<WheelTask.Kind, Integer> discarded = timer.stop();
        stopped = true;

        assertThat(discarded).containsOnly(
                entry(WheelTask.Kind.RETRY_BACKOFF, 2),
                entry(WheelTask.Kind.DEADLINE, 1));
        assertThatThrownBy(backoff::join).isInstanceOf(CancellationException.class);
    }

    @Test
    void afterStop_delayFailsAndScheduleRejects() {
        timer.stop();
        stopped = true;

        CompletableFuture<Void> pause = timer.delay(WheelTask.Kind.BATCH_PAUSE, 700);

        assertThat(pause).isCompletedExceptionally();
        assertThatThrownBy(pause::join).isInstanceOf(CancellationException.class);
        assertThatThrownBy(() -> timer.schedule(WheelTask.Kind.DEADLINE, () -> { }, 1000))
                .isInstanceOf(CancellationException.class)
                .hasMessage("timer stopped");
    }
}
