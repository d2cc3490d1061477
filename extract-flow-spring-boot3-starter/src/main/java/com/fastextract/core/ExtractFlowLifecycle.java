package com.fastextract.core;

import com.fastextract.config.ExtractFlowProperties;
import com.fastextract.config.ExtractNotifierProperties;
import com.fastextract.core.notify.AsyncNotifyingService;
import com.fastextract.core.timer.HashedWheelTaskTimer;
import com.fastextract.core.timer.WheelTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 启动时打印关键配置; 停机时停止时间轮并排空通知线程池
 * 停止后未触发的退避/批间隔/截止任务全部以取消结束
 */
public class ExtractFlowLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExtractFlowLifecycle.class);

    private final HashedWheelTaskTimer timer;

    private final AsyncNotifyingService notifyingService;

    private final ExtractFlowProperties props;

    private final ExtractNotifierProperties notifyProps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ExtractFlowLifecycle(HashedWheelTaskTimer timer,
                                AsyncNotifyingService notifyingService,
                                ExtractFlowProperties props,
                                ExtractNotifierProperties notifyProps) {
        this.timer = timer;
        this.notifyingService = notifyingService;
        this.props = props;
        this.notifyProps = notifyProps;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ Extract-Flow starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ timer.tick            : {} ms", props.getTimer().getTickDuration().toMillis());
            log.info("│ timer.size            : {}", props.getTimer().getTicksPerWheel());
            log.info("│ retry.maxAttempts     : {}", props.getRetry().getMaxAttempts());
            log.info("│ retry.delay           : {} - {} ms", props.getRetry().getBaseDelay().toMillis(),
                    props.getRetry().getMaxDelay().toMillis());
            log.info("│ breaker.threshold     : {} / reset {} ms", props.getCircuitBreaker().getFailureThreshold(),
                    props.getCircuitBreaker().getResetTimeout().toMillis());
            log.info("│ save.batch            : {} every {} ms", props.getSave().getMaxConcurrency(),
                    props.getSave().getInterBatchDelay().toMillis());
            log.info("│ fetch.timeout         : {} ms", props.getFetch().getTimeout().toMillis());
            log.info("│ workflow.sourceLimits : {} / {}", props.getWorkflow().getSourceSoftLimit(),
                    props.getWorkflow().getSourceHardLimit());
            log.info("│ notifier.enabled      : {}", notifyProps.isEnabled());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (RuntimeException t) {
            log.warn("[Extract-Flow] failed to render startup banner: {}", t.toString());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Extract-Flow] stop skipped: already stopped");
            return;
        }
        log.info("[Extract-Flow] stopping...");
        try {
            // 自定义 TaskTimer 时由使用方负责停止
            if (timer != null) {
                Map<WheelTask.Kind, Integer> discarded = timer.stop();
                if (!discarded.isEmpty()) {
                    log.warn("[Extract-Flow] in-flight waits cancelled on shutdown: {}", discarded);
                }
            }
        } finally {
            if (notifyingService != null) {
                notifyingService.shutdown(props.getShutdown().getAwait());
            }
            log.info("[Extract-Flow] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
