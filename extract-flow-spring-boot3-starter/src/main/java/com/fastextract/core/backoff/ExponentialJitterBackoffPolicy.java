package com.fastextract.core.backoff;

import com.fastextract.core.retry.RetryPolicy;
import com.fastextract.core.spi.BackoffPolicy;
import com.fastextract.exception.InvalidConfigurationException;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 指数退避 + 正向抖动
 * delay = min(base * 2^(n-1) + uniform[0, base * jitterRatio), max)
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    public static final double DEFAULT_JITTER_RATIO = 0.2;

    private final double jitterRatio;

    public ExponentialJitterBackoffPolicy() {
        this(DEFAULT_JITTER_RATIO);
    }

    public ExponentialJitterBackoffPolicy(double jitterRatio) {
        if (jitterRatio < 0 || jitterRatio >= 1) {
            throw new InvalidConfigurationException("jitterRatio must be in [0, 1), got " + jitterRatio);
        }
        this.jitterRatio = jitterRatio;
    }

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public long delayMillis(int failedAttempt, RetryPolicy policy) {
        long base = policy.getBaseDelayMs();
        long max = policy.getMaxDelayMs();

        // 第 1 次失败 -> base, 第 2 次 -> base * 2 ...
        double pow = Math.pow(2.0, Math.max(0, failedAttempt - 1));
        double ideal = Math.min((double) Long.MAX_VALUE, base * pow);

        double jitter = 0;
        double bound = base * jitterRatio;
        if (bound > 0) {
            jitter = ThreadLocalRandom.current().nextDouble(0, bound);
        }
        long delay = (long) Math.min(ideal + jitter, (double) max);
        return Math.max(0, delay);
    }
}
