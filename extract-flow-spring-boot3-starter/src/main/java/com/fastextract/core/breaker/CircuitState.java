package com.fastextract.core.breaker;

public enum CircuitState {
    /** 正常放行 */
    CLOSED,
    /** 快速失败 */
    OPEN,
    /** 冷却结束后的探测 */
    HALF_OPEN
}
