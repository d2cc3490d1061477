package com.fastextract.core.save;

import com.fastextract.exception.InvalidConfigurationException;
import lombok.Getter;
import lombok.ToString;

/**
 * 批量保存节奏
 * 默认每批 1 条、批间隔 700ms, 约 1.4 req/s
 */
@Getter
@ToString
public final class SaveSettings {

    public static final int DEFAULT_MAX_CONCURRENCY = 1;
    public static final long DEFAULT_INTER_BATCH_DELAY_MS = 700;

    private final int maxConcurrency;

    private final long interBatchDelayMs;

    public SaveSettings(int maxConcurrency, long interBatchDelayMs) {
        if (maxConcurrency <= 0) {
            throw new InvalidConfigurationException("maxConcurrency must be > 0, got " + maxConcurrency);
        }
        if (interBatchDelayMs < 0) {
            throw new InvalidConfigurationException("interBatchDelayMs must be >= 0, got " + interBatchDelayMs);
        }
        this.maxConcurrency = maxConcurrency;
        this.interBatchDelayMs = interBatchDelayMs;
    }

    public static SaveSettings defaults() {
        return new SaveSettings(DEFAULT_MAX_CONCURRENCY, DEFAULT_INTER_BATCH_DELAY_MS);
    }
}
