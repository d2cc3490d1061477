package com.fastextract.core.retry;

import com.fastextract.exception.InvalidConfigurationException;

import java.util.function.Predicate;

/**
 * 重试策略, build() 时校验, 非法配置直接失败
 */
public final class RetryPolicy {

    private final int maxAttempts;

    private final long baseDelayMs;

    private final long maxDelayMs;

    private final Predicate<Throwable> shouldRetry;

    private final RetryListener onRetry;

    private RetryPolicy(Builder b) {
        this.maxAttempts = b.maxAttempts;
        this.baseDelayMs = b.baseDelayMs;
        this.maxDelayMs = b.maxDelayMs;
        this.shouldRetry = b.shouldRetry;
        this.onRetry = b.onRetry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelayMs(baseDelayMs)
                .maxDelayMs(maxDelayMs)
                .shouldRetry(shouldRetry)
                .onRetry(onRetry);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public long getBaseDelayMs() { return baseDelayMs; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public Predicate<Throwable> getShouldRetry() { return shouldRetry; }
    public RetryListener getOnRetry() { return onRetry; }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelayMs=" + baseDelayMs + ", maxDelayMs=" + maxDelayMs + '}';
    }

    public static final class Builder {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 10_000;
        private Predicate<Throwable> shouldRetry = e -> true;
        private RetryListener onRetry = RetryListener.NO_OP;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
        public Builder baseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; return this; }
        public Builder maxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; return this; }

        public Builder shouldRetry(Predicate<Throwable> shouldRetry) {
            this.shouldRetry = shouldRetry == null ? e -> true : shouldRetry;
            return this;
        }

        public Builder onRetry(RetryListener onRetry) {
            this.onRetry = onRetry == null ? RetryListener.NO_OP : onRetry;
            return this;
        }

        public RetryPolicy build() {
            if (maxAttempts <= 0) {
                throw new InvalidConfigurationException("maxAttempts must be > 0, got " + maxAttempts);
            }
            if (baseDelayMs <= 0) {
                throw new InvalidConfigurationException("baseDelayMs must be > 0, got " + baseDelayMs);
            }
            if (maxDelayMs < baseDelayMs) {
                throw new InvalidConfigurationException(
                        "maxDelayMs must be >= baseDelayMs, got max=" + maxDelayMs + " base=" + baseDelayMs);
            }
            return new RetryPolicy(this);
        }
    }
}
