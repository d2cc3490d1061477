package com.fastextract.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 熔断打开 */
    CIRCUIT_OPENED,

    /** 熔断进入半开探测 */
    CIRCUIT_HALF_OPEN,

    /** 熔断恢复 */
    CIRCUIT_CLOSED,

    /** 批量保存存在失败条目 */
    SAVE_FAILURES,

    /** 富化抓取超时 */
    FETCH_TIMEOUT,

    /** 来源数量超过软上限 */
    SOURCE_LIMIT_WARNING,

    /** 工作流失败 */
    WORKFLOW_FAILED
}
