package com.fastextract.core.timer;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的任务封装
 * 让 timer.stop() 返回的 Timeout 能识别任务类型
 */
public class WheelTask implements TimerTask {

    public enum Kind { RETRY_BACKOFF, BATCH_PAUSE, DEADLINE }

    private final Kind kind;

    /** 真正要执行的逻辑 */
    private final Runnable actual;

    /** 停机丢弃时的补偿, 可为 null */
    private final Runnable onDiscard;

    public WheelTask(Kind kind, Runnable actual, Runnable onDiscard) {
        this.kind = kind;
        this.actual = actual;
        this.onDiscard = onDiscard;
    }

    @Override
    public void run(Timeout timeout) throws Exception {
        actual.run();
    }

    /**
     * 定时器停止而任务未触发
     */
    public void discard() {
        if (onDiscard != null) {
            onDiscard.run();
        }
    }

    public Kind getKind() {
        return kind;
    }
}
