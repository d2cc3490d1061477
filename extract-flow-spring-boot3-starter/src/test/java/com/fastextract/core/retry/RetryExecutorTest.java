package com.fastextract.core.retry;

import com.fastextract.core.backoff.ExponentialJitterBackoffPolicy;
import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.timer.HashedWheelTaskTimer;
import com.fastextract.core.timer.TaskTimer;
import com.fastextract.core.timer.WheelTask;
import com.fastextract.exception.InvalidConfigurationException;
import com.fastextract.support.ImmediateTaskTimer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private ImmediateTaskTimer timer;
    private SimpleMeterRegistry registry;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        timer = new ImmediateTaskTimer();
        registry = new SimpleMeterRegistry();
        executor = new RetryExecutor(timer, new ExponentialJitterBackoffPolicy(), ExtractMetrics.create(registry));
    }

    @Test
    void executeWithRetry_failsTwiceThenSucceeds_backsOffExponentially() {
        AtomicInteger calls = new AtomicInteger();
        List<Integer> retriedAttempts = new ArrayList<>();
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelayMs(1000)
                .maxDelayMs(10_000)
                .onRetry((attempt, e, delay) -> retriedAttempts.add(attempt))
                .build();

        String result = executor.executeWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(new RuntimeException("503 Service Unavailable"));
            }
            return CompletableFuture.completedFuture("ok");
        }, policy).join();

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(retriedAttempts).containsExactly(1, 2);
        List<Long> delays = timer.delaysOf(WheelTask.Kind.RETRY_BACKOFF);
        assertThat(delays).hasSize(2);
        assertThat(delays.get(0)).isBetween(1000L, 1199L);
        assertThat(delays.get(1)).isBetween(2000L, 2399L);
        assertThat(registry.get("extract.retry").counter().count()).isEqualTo(2.0);
    }

    @Test
    void executeWithRetry_exhausted_propagatesLastErrorUnwrapped() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).baseDelayMs(10).maxDelayMs(50).build();

        CompletableFuture<String> f = executor.executeWithRetry(() ->
                CompletableFuture.failedFuture(new IllegalStateException("failure #" + calls.incrementAndGet())), policy);

        assertThatThrownBy(f::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("failure #3");
        assertThat(calls).hasValue(3);
    }

    @Test
    void executeWithRetry_predicateRejects_stopsAfterFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder()
                .shouldRetry(e -> !(e instanceof IllegalArgumentException))
                .build();

        CompletableFuture<String> f = executor.executeWithRetry(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalArgumentException("bad input"));
        }, policy);

        assertThatThrownBy(f::join).cause().isInstanceOf(IllegalArgumentException.class);
        assertThat(calls).hasValue(1);
        assertThat(timer.delays()).isEmpty();
    }

    @Test
    void executeWithRetry_synchronousThrow_countsAsFailedAttempt() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(2).baseDelayMs(10).maxDelayMs(10).build();

        String result = executor.executeWithRetry(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("thrown before any future");
            }
            return CompletableFuture.completedFuture("second");
        }, policy).join();

        assertThat(result).isEqualTo("second");
        assertThat(calls).hasValue(2);
    }

    @Test
    void executeWithRetry_throwingListener_doesNotBreakRetry() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(2)
                .baseDelayMs(10)
                .maxDelayMs(10)
                .onRetry((attempt, e, delay) -> {
                    throw new IllegalStateException("listener bug");
                })
                .build();

        String result = executor.executeWithRetry(() -> calls.incrementAndGet() == 1
                ? CompletableFuture.failedFuture(new RuntimeException("flaky"))
                : CompletableFuture.completedFuture("ok"), policy).join();

        assertThat(result).isEqualTo("ok");
    }

    @Test
    void executeWithRetry_timerStopped_failsWithTimerErrorAndKeepsCause() {
        TaskTimer stopped = new TaskTimer() {
            @Override
            public ScheduledHandle schedule(WheelTask.Kind kind, Runnable task, long delayMs) {
                return () -> false;
            }

            @Override
            public CompletableFuture<Void> delay(WheelTask.Kind kind, long delayMs) {
                return CompletableFuture.failedFuture(new CancellationException("timer stopped"));
            }
        };
        RetryExecutor stoppedExecutor = new RetryExecutor(stopped, new ExponentialJitterBackoffPolicy(),
                ExtractMetrics.create(new SimpleMeterRegistry()));

        CompletableFuture<String> f = stoppedExecutor.executeWithRetry(
                () -> CompletableFuture.failedFuture(new RuntimeException("flaky")), RetryPolicy.builder().build());

        assertThatThrownBy(f::join)
                .isInstanceOf(CancellationException.class)
                .satisfies(e -> assertThat(e.getSuppressed()).extracting(Throwable::getMessage).containsExactly("flaky"));
    }

    @Test
    void executeWithRetry_onStoppedWheel_completesInsteadOfHanging() {
        HashedWheelTaskTimer wheel = new HashedWheelTaskTimer(new HashedWheelTimer(10, TimeUnit.MILLISECONDS));
        wheel.stop();
        RetryExecutor afterShutdown = new RetryExecutor(wheel, new ExponentialJitterBackoffPolicy(),
                ExtractMetrics.create(registry));

        CompletableFuture<String> f = afterShutdown.executeWithRetry(
                () -> CompletableFuture.failedFuture(new RuntimeException("flaky")),
                RetryPolicy.builder().baseDelayMs(10).build());

        assertThat(f).isDone();
        assertThatThrownBy(f::join)
                .isInstanceOf(CancellationException.class)
                .hasMessage("timer stopped");
    }

    @Test
    void build_rejectsInvalidPolicies() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0).build())
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().baseDelayMs(0).build())
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().baseDelayMs(5000).maxDelayMs(1000).build())
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void backoff_isCappedAtMaxDelay() {
        RetryPolicy policy = RetryPolicy.builder().baseDelayMs(1000).maxDelayMs(3000).build();
        ExponentialJitterBackoffPolicy backoff = new ExponentialJitterBackoffPolicy();

        assertThat(backoff.delayMillis(5, policy)).isEqualTo(3000L);
        assertThatThrownBy(() -> new ExponentialJitterBackoffPolicy(1.0))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
