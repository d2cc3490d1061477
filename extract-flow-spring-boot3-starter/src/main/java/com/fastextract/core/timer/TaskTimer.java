package com.fastextract.core.timer;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * 非阻塞定时器
 * 重试退避、批次间隔、超时截止线都经由它挂起, 不占用调用线程
 */
public interface TaskTimer {

    /**
     * 延迟执行
     * @param kind 任务类型, 停机时用于区分如何处理未触发任务
     * @throws CancellationException 定时器已停止
     */
    ScheduledHandle schedule(WheelTask.Kind kind, Runnable task, long delayMs);

    /**
     * 挂起 delayMs 后完成; 定时器停止时以 CancellationException 完成
     */
    default CompletableFuture<Void> delay(WheelTask.Kind kind, long delayMs) {
        CompletableFuture<Void> f = new CompletableFuture<>();
        if (delayMs <= 0) {
            f.complete(null);
            return f;
        }
        try {
            schedule(kind, () -> f.complete(null), delayMs);
        } catch (CancellationException e) {
            f.completeExceptionally(e);
        }
        return f;
    }

    /**
     * 定时任务句柄
     */
    interface ScheduledHandle {

        /** 取消尚未触发的任务, 已触发返回 false */
        boolean cancel();
    }
}
