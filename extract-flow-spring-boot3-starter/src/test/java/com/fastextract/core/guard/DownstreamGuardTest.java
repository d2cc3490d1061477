package com.fastextract.core.guard;

import com.fastextract.config.ExtractGuardProperties;
import com.fastextract.exception.guard.DownstreamBulkheadFullException;
import com.fastextract.exception.guard.DownstreamRateLimitedException;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DownstreamGuardTest {

    @Test
    void execute_passThrough_returnsDelegateResult() {
        DownstreamGuard guard = DownstreamGuard.passThrough();

        assertThat(guard.execute(DownstreamGuard.ENRICHMENT, () -> CompletableFuture.completedFuture("ok")).join())
                .isEqualTo("ok");
    }

    @Test
    void execute_passThrough_keepsOriginalFailure() {
        DownstreamGuard guard = DownstreamGuard.passThrough();

        CompletableFuture<String> f = guard.execute(DownstreamGuard.PERSISTENCE, () -> {
            throw new IllegalStateException("sync failure");
        });

        assertThatThrownBy(f::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("sync failure");
    }

    @Test
    void execute_rateLimiterExhausted_failsWithRateLimitedException() {
        ExtractGuardProperties props = new ExtractGuardProperties();
        ExtractGuardProperties.RlConfig rl = new ExtractGuardProperties.RlConfig();
        rl.setEnabled(true);
        rl.setLimitForPeriod(1);
        rl.setLimitRefreshPeriod(Duration.ofMinutes(1));
        rl.setTimeoutDuration(Duration.ZERO);
        props.setRlPerDependency(Map.of(DownstreamGuard.PERSISTENCE, rl));
        DownstreamGuard guard = new DownstreamGuard(props);

        assertThat(guard.execute(DownstreamGuard.PERSISTENCE, () -> CompletableFuture.completedFuture(1)).join())
                .isEqualTo(1);
        CompletableFuture<Integer> limited = guard.execute(DownstreamGuard.PERSISTENCE,
                () -> CompletableFuture.completedFuture(2));

        assertThatThrownBy(limited::join)
                .cause()
                .isInstanceOf(DownstreamRateLimitedException.class)
                .hasCauseInstanceOf(RequestNotPermitted.class);
        // 其他依赖不受影响
        assertThat(guard.execute(DownstreamGuard.ENRICHMENT, () -> CompletableFuture.completedFuture(3)).join())
                .isEqualTo(3);
    }

    @Test
    void execute_bulkheadFull_rejectsUntilPermitReleased() {
        ExtractGuardProperties props = new ExtractGuardProperties();
        props.getBulkhead().setEnabled(true);
        props.getBulkhead().setMaxConcurrentCalls(1);
        props.getBulkhead().setMaxWaitDuration(Duration.ZERO);
        DownstreamGuard guard = new DownstreamGuard(props);
        CompletableFuture<String> inFlight = new CompletableFuture<>();

        CompletableFuture<String> first = guard.execute(DownstreamGuard.ENRICHMENT, () -> inFlight);
        CompletableFuture<String> rejected = guard.execute(DownstreamGuard.ENRICHMENT,
                () -> CompletableFuture.completedFuture("second"));

        assertThatThrownBy(rejected::join)
                .cause()
                .isInstanceOf(DownstreamBulkheadFullException.class)
                .hasCauseInstanceOf(BulkheadFullException.class);

        inFlight.complete("first");
        assertThat(first.join()).isEqualTo("first");
        assertThat(guard.execute(DownstreamGuard.ENRICHMENT, () -> CompletableFuture.completedFuture("third")).join())
                .isEqualTo("third");
    }
}
