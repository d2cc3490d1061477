package com.fastextract.core.breaker;

/**
 * 状态迁移回调, 在熔断器锁外执行
 */
public interface CircuitStateListener {

    CircuitStateListener NO_OP = (from, to, stats) -> { };

    void onTransition(CircuitState from, CircuitState to, CircuitBreakerStats stats);

    /** OPEN 状态下拒绝一次调用 */
    default void onRejected(CircuitBreakerStats stats) {
    }
}
