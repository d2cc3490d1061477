package com.fastextract.core.notify.notifier;

import com.fastextract.core.spi.notify.Notifier;
import com.fastextract.model.ctx.NotifyContext;
import com.fastextract.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 默认启用
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] component={}, reason={}, err={}, attrs={}",
                    ctx.getType(), ctx.getComponent(), ctx.getReasonCode(), truncate(ctx.getLastError()), ctx.getAttributes());
            case WARNING -> log.warn("[Notify-{}] component={}, reason={}, attrs={}",
                    ctx.getType(), ctx.getComponent(), ctx.getReasonCode(), ctx.getAttributes());
            default -> log.info("[Notify-{}] component={}, attrs={}", ctx.getType(), ctx.getComponent(), ctx.getAttributes());
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
