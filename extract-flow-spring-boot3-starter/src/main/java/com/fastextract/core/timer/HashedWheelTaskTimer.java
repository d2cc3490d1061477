package com.fastextract.core.timer;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Netty HashedWheelTimer 的定时器实现
 */
public class HashedWheelTaskTimer implements TaskTimer {

    private static final Logger log = LoggerFactory.getLogger(HashedWheelTaskTimer.class);

    /** 时间轮 */
    private final HashedWheelTimer timer;

    public HashedWheelTaskTimer(HashedWheelTimer timer) {
        this.timer = timer;
    }

    @Override
    public ScheduledHandle schedule(WheelTask.Kind kind, Runnable task, long delayMs) {
        return schedule(new WheelTask(kind, task, null), delayMs);
    }

    @Override
    public CompletableFuture<Void> delay(WheelTask.Kind kind, long delayMs) {
        CompletableFuture<Void> f = new CompletableFuture<>();
        if (delayMs <= 0) {
            f.complete(null);
            return f;
        }
        // 停机时未触发的等待以取消结束, 避免调用方永久挂起
        try {
            schedule(new WheelTask(kind, () -> f.complete(null),
                    () -> f.completeExceptionally(new CancellationException("timer stopped"))), delayMs);
        } catch (CancellationException e) {
            f.completeExceptionally(e);
        }
        return f;
    }

    private ScheduledHandle schedule(WheelTask task, long delayMs) {
        Timeout t;
        try {
            t = timer.newTimeout(task, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        } catch (IllegalStateException e) {
            // 时间轮已 stop
            log.debug("[Extract-Flow] reject {} task, timer stopped", task.getKind());
            CancellationException ce = new CancellationException("timer stopped");
            ce.initCause(e);
            throw ce;
        }
        return t::cancel;
    }

    /**
     * 停止时间轮, 对未触发的任务执行丢弃补偿
     * @return 各类型被丢弃的数量
     */
    public Map<WheelTask.Kind, Integer> stop() {
        Set<Timeout> unProcessed = timer.stop();
        Map<WheelTask.Kind, Integer> drained = new EnumMap<>(WheelTask.Kind.class);
        if (unProcessed == null || unProcessed.isEmpty()) {
            log.info("[Extract-Flow] timer stopped with no unprocessed timeouts.");
            return drained;
        }
        for (Timeout t : unProcessed) {
            if (t == null || !(t.task() instanceof WheelTask wt)) {
                continue;
            }
            try {
                wt.discard();
            } catch (RuntimeException e) {
                log.warn("[Extract-Flow] discard of {} task failed: {}", wt.getKind(), e.toString());
            }
            drained.merge(wt.getKind(), 1, Integer::sum);
        }
        log.info("[Extract-Flow] timer stopped, discarded pending tasks={}", drained);
        return drained;
    }
}
