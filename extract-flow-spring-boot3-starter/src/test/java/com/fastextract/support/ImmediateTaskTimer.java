package com.fastextract.support;

import com.fastextract.core.timer.TaskTimer;
import com.fastextract.core.timer.WheelTask;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 测试用定时器: delay() 立即完成并记录时长; schedule() 只登记, 由测试手动触发
 */
public class ImmediateTaskTimer implements TaskTimer {

    private final List<Long> delays = new ArrayList<>();

    private final List<WheelTask.Kind> delayKinds = new ArrayList<>();

    private final List<Pending> pending = new ArrayList<>();

    @Override
    public synchronized ScheduledHandle schedule(WheelTask.Kind kind, Runnable task, long delayMs) {
        Pending p = new Pending(kind, task);
        pending.add(p);
        return () -> {
            synchronized (ImmediateTaskTimer.this) {
                return pending.remove(p);
            }
        };
    }

    @Override
    public CompletableFuture<Void> delay(WheelTask.Kind kind, long delayMs) {
        synchronized (this) {
            delays.add(delayMs);
            delayKinds.add(kind);
        }
        return CompletableFuture.completedFuture(null);
    }

    /** 触发某类尚未取消的登记任务 */
    public void fire(WheelTask.Kind kind) {
        List<Pending> due = new ArrayList<>();
        synchronized (this) {
            for (Pending p : pending) {
                if (p.kind == kind) {
                    due.add(p);
                }
            }
            pending.removeAll(due);
        }
        due.forEach(p -> p.task.run());
    }

    public synchronized List<Long> delays() {
        return new ArrayList<>(delays);
    }

    public synchronized List<Long> delaysOf(WheelTask.Kind kind) {
        List<Long> out = new ArrayList<>();
        for (int i = 0; i < delays.size(); i++) {
            if (delayKinds.get(i) == kind) {
                out.add(delays.get(i));
            }
        }
        return out;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private static final class Pending {
        private final WheelTask.Kind kind;
        private final Runnable task;

        private Pending(WheelTask.Kind kind, Runnable task) {
            this.kind = kind;
            this.task = task;
        }
    }
}
