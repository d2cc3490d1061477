package com.fastextract.core.spi.notify;

import com.fastextract.model.ctx.NotifyContext;
import com.fastextract.model.enums.Severity;

/**
 * 过滤器: 限流、去抖等
 */
public interface NotifierFilter {

    /**
     * 返回 true 表示放行, false 表示抑制
     */
    boolean allow(NotifyContext ctx, Severity severity);
}
