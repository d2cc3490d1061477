package com.fastextract.exception.guard;

import java.time.Instant;

/**
 * 熔断打开时的快速失败
 * 独立类型, 调用方无需匹配消息文本即可识别"服务降级"
 */
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;

    private final Instant nextAttemptTime;

    public CircuitOpenException(String breakerName, Instant nextAttemptTime) {
        super("Circuit breaker [" + breakerName + "] is OPEN, service unavailable until " + nextAttemptTime);
        this.breakerName = breakerName;
        this.nextAttemptTime = nextAttemptTime;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Instant getNextAttemptTime() {
        return nextAttemptTime;
    }
}
