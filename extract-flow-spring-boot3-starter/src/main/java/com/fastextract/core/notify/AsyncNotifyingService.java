package com.fastextract.core.notify;

import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.spi.notify.Notifier;
import com.fastextract.core.spi.notify.NotifierFilter;
import com.fastextract.model.ctx.NotifyContext;
import com.fastextract.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 异步派发
 * 限流后在独立线程池中逐个通知, 每个渠道最多投递 3 次
 */
public class AsyncNotifyingService {

    private static final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    static final int MAX_DELIVERY_ATTEMPTS = 3;

    private final ExecutorService exec;

    private final List<Notifier> notifiers;

    private final NotifierFilter filter;

    private final ExtractMetrics metrics;

    private final long initialBackoffMs;

    public AsyncNotifyingService(ExecutorService exec, List<Notifier> notifiers, NotifierFilter filter, ExtractMetrics metrics) {
        this(exec, notifiers, filter, metrics, 200);
    }

    public AsyncNotifyingService(ExecutorService exec, List<Notifier> notifiers, NotifierFilter filter,
                                 ExtractMetrics metrics, long initialBackoffMs) {
        this.exec = exec;
        this.notifiers = notifiers == null ? List.of() : List.copyOf(notifiers);
        this.filter = filter;
        this.metrics = metrics;
        this.initialBackoffMs = initialBackoffMs;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        try {
            exec.execute(() -> dispatch(ctx, sev));
        } catch (RejectedExecutionException e) {
            metrics.incNotifyFailed();
            log.warn("[Notify] executor rejected event={}: {}", ctx.getType(), e.toString());
        }
    }

    private void dispatch(NotifyContext ctx, Severity sev) {
        for (Notifier n : notifiers) {
            if (!n.supports(ctx)) {
                continue;
            }
            try {
                deliver(n, ctx, sev);
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                log.warn("[Notify] channel={} event={} interrupted", n.name(), ctx.getType());
                return;
            } catch (Exception e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
            }
        }
    }

    private void deliver(Notifier n, NotifyContext ctx, Severity sev) throws Exception {
        int attempt = 0;
        long backoff = initialBackoffMs;
        while (true) {
            try {
                n.notify(ctx, sev);
                return;
            } catch (RuntimeException e) {
                if (++attempt >= MAX_DELIVERY_ATTEMPTS) {
                    throw e;
                }
                // 通知线程内退避
                Thread.sleep(backoff);
                backoff = Math.min(backoff * 2, 4000);
            }
        }
    }

    /**
     * 停止接收新事件, 等待队列中的通知发完
     * @return 是否在等待时间内全部结束
     */
    public boolean shutdown(Duration await) {
        exec.shutdown();
        try {
            boolean done = exec.awaitTermination(await.toMillis(), TimeUnit.MILLISECONDS);
            if (!done) {
                List<Runnable> dropped = exec.shutdownNow();
                log.warn("[Notify] executor did not drain in {} ms, dropped={}", await.toMillis(), dropped.size());
            }
            return done;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
            return false;
        }
    }
}
