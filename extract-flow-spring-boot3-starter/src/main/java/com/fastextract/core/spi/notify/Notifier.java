package com.fastextract.core.spi.notify;

import com.fastextract.model.ctx.NotifyContext;
import com.fastextract.model.enums.Severity;

/**
 * 告警通知器（熔断、超时、批量失败等）
 */
public interface Notifier {

    /**
     * 渠道名, 用于日志与指标维度
     */
    String name();

    /**
     * 能否处理此事件, 粗粒度过滤
     */
    default boolean supports(NotifyContext ctx) {
        return true;
    }

    /**
     * 派发通知, 同步方法, 框架层负责异步调用
     */
    void notify(NotifyContext ctx, Severity severity);
}
