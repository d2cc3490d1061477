package com.fastextract.core.breaker;

import com.fastextract.core.failure.NormalizedError;
import com.fastextract.exception.guard.CircuitOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 三态熔断器, 每个下游依赖一个实例
 * CLOSED 连续失败达到阈值 -> OPEN; OPEN 冷却结束后首次读取状态 -> HALF_OPEN;
 * HALF_OPEN 任一失败 -> OPEN, 连续成功达到阈值 -> CLOSED
 * 进入新状态时计数器全部清零
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;

    private final CircuitBreakerConfig config;

    private final Clock clock;

    private final CircuitStateListener listener;

    /* 以下状态由 this 锁保护 */
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant nextAttemptTime;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), CircuitStateListener.NO_OP);
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, CircuitStateListener listener) {
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.listener = listener == null ? CircuitStateListener.NO_OP : listener;
    }

    /**
     * OPEN 时直接以 CircuitOpenException 失败, 不调用 operation
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation) {
        Transition t;
        CircuitBreakerStats rejected = null;
        synchronized (this) {
            t = refreshState();
            if (state == CircuitState.OPEN) {
                rejected = statsLocked();
            }
        }
        publish(t);
        if (rejected != null) {
            fireRejected(rejected);
            return CompletableFuture.failedFuture(new CircuitOpenException(name, rejected.getNextAttemptTime()));
        }

        CompletableFuture<T> call;
        try {
            call = operation.get();
        } catch (RuntimeException e) {
            onFailure();
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        call.whenComplete((v, err) -> {
            if (err == null) {
                onSuccess();
                result.complete(v);
            } else {
                onFailure();
                result.completeExceptionally(NormalizedError.unwrap(err));
            }
        });
        return result;
    }

    /**
     * 读取状态; OPEN 且冷却已过时迁移到 HALF_OPEN
     */
    public CircuitState getState() {
        Transition t;
        CircuitState s;
        synchronized (this) {
            t = refreshState();
            s = state;
        }
        publish(t);
        return s;
    }

    public CircuitBreakerStats getStats() {
        Transition t;
        CircuitBreakerStats stats;
        synchronized (this) {
            t = refreshState();
            stats = statsLocked();
        }
        publish(t);
        return stats;
    }

    /**
     * 手动复位到 CLOSED
     */
    public void reset() {
        Transition t;
        synchronized (this) {
            t = moveTo(CircuitState.CLOSED);
        }
        publish(t);
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private void onSuccess() {
        Transition t = null;
        synchronized (this) {
            switch (state) {
                case CLOSED -> failureCount = 0;
                case HALF_OPEN -> {
                    successCount++;
                    if (successCount >= config.getSuccessThreshold()) {
                        t = moveTo(CircuitState.CLOSED);
                    }
                }
                // OPEN 期间到达的迟到结果不计数
                case OPEN -> { }
            }
        }
        publish(t);
    }

    private void onFailure() {
        Transition t = null;
        synchronized (this) {
            switch (state) {
                case CLOSED -> {
                    failureCount++;
                    if (failureCount >= config.getFailureThreshold()) {
                        t = moveTo(CircuitState.OPEN);
                    }
                }
                case HALF_OPEN -> t = moveTo(CircuitState.OPEN);
                case OPEN -> { }
            }
        }
        publish(t);
    }

    private Transition refreshState() {
        if (state == CircuitState.OPEN && !clock.instant().isBefore(nextAttemptTime)) {
            return moveTo(CircuitState.HALF_OPEN);
        }
        return null;
    }

    private Transition moveTo(CircuitState target) {
        CircuitState from = state;
        state = target;
        failureCount = 0;
        successCount = 0;
        nextAttemptTime = target == CircuitState.OPEN
                ? clock.instant().plusMillis(config.getResetTimeoutMs())
                : null;
        if (from == target) {
            return null;
        }
        return new Transition(from, target, statsLocked());
    }

    private CircuitBreakerStats statsLocked() {
        return new CircuitBreakerStats(name, state, failureCount, successCount, nextAttemptTime);
    }

    private void publish(Transition t) {
        if (t == null) {
            return;
        }
        log.info("[CircuitBreaker] {} {} -> {}{}", name, t.from, t.to,
                t.to == CircuitState.OPEN ? ", next attempt at " + t.stats.getNextAttemptTime() : "");
        try {
            listener.onTransition(t.from, t.to, t.stats);
        } catch (RuntimeException e) {
            log.warn("[CircuitBreaker] {} transition listener threw, ignored: {}", name, e.toString());
        }
    }

    private void fireRejected(CircuitBreakerStats stats) {
        try {
            listener.onRejected(stats);
        } catch (RuntimeException e) {
            log.warn("[CircuitBreaker] {} rejection listener threw, ignored: {}", name, e.toString());
        }
    }

    private static final class Transition {
        private final CircuitState from;
        private final CircuitState to;
        private final CircuitBreakerStats stats;

        private Transition(CircuitState from, CircuitState to, CircuitBreakerStats stats) {
            this.from = from;
            this.to = to;
            this.stats = stats;
        }
    }
}
