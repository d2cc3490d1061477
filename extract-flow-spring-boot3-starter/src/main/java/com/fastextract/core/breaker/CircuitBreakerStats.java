package com.fastextract.core.breaker;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 状态快照
 */
@Getter
@ToString
@AllArgsConstructor
public final class CircuitBreakerStats {

    private final String name;
    private final CircuitState state;
    private final int failureCount;
    private final int successCount;
    /** 仅 OPEN 时有值 */
    private final Instant nextAttemptTime;
}
