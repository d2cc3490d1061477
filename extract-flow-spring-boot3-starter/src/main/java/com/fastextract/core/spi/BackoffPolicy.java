package com.fastextract.core.spi;

import com.fastextract.core.retry.RetryPolicy;

/**
 * 回退策略（计算下一次重试前的等待时长）
 */
public interface BackoffPolicy {

    /** 策略唯一名称 */
    String name();

    /**
     * @param failedAttempt 刚失败的是第几次尝试, 从 1 开始
     * @param policy        读取 base/max
     * @return 等待毫秒数, 不超过 policy 的 maxDelayMs
     */
    long delayMillis(int failedAttempt, RetryPolicy policy);
}
