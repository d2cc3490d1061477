package com.fastextract.core.retry;

/**
 * 每次决定重试、进入等待前回调
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NO_OP = (attempt, error, delayMs) -> { };

    /**
     * @param attempt 刚失败的尝试序号, 从 1 开始
     * @param error   本次失败
     * @param delayMs 即将等待的毫秒数
     */
    void onRetry(int attempt, Throwable error, long delayMs);
}
