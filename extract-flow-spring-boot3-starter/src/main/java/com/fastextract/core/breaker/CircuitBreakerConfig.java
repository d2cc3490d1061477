package com.fastextract.core.breaker;

import com.fastextract.exception.InvalidConfigurationException;
import lombok.Getter;
import lombok.ToString;

/**
 * 熔断器参数, 构造即校验
 */
@Getter
@ToString
public final class CircuitBreakerConfig {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_RESET_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;

    /** CLOSED 下连续失败多少次打开 */
    private final int failureThreshold;

    /** OPEN 冷却时长 */
    private final long resetTimeoutMs;

    /** HALF_OPEN 下连续成功多少次关闭 */
    private final int successThreshold;

    private CircuitBreakerConfig(int failureThreshold, long resetTimeoutMs, int successThreshold) {
        if (failureThreshold <= 0) {
            throw new InvalidConfigurationException("failureThreshold must be > 0, got " + failureThreshold);
        }
        if (resetTimeoutMs <= 0) {
            throw new InvalidConfigurationException("resetTimeoutMs must be > 0, got " + resetTimeoutMs);
        }
        if (successThreshold <= 0) {
            throw new InvalidConfigurationException("successThreshold must be > 0, got " + successThreshold);
        }
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMs = resetTimeoutMs;
        this.successThreshold = successThreshold;
    }

    public static CircuitBreakerConfig of(int failureThreshold, long resetTimeoutMs, int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, resetTimeoutMs, successThreshold);
    }

    public static CircuitBreakerConfig defaults() {
        return of(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RESET_TIMEOUT_MS, DEFAULT_SUCCESS_THRESHOLD);
    }
}
