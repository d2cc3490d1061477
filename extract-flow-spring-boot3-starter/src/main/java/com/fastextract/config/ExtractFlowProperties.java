package com.fastextract.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 抽取流水线配置（绑定前缀：extract）
 *
 * YAML 示例：
 * extract:
 *   timer:
 *     tick-duration: 10ms
 *     ticks-per-wheel: 512
 *   retry:
 *     max-attempts: 3
 *     base-delay: 1s
 *     max-delay: 10s
 *     jitter-ratio: 0.2
 *   circuit-breaker:
 *     failure-threshold: 5
 *     reset-timeout: 30s
 *     success-threshold: 2
 *     per-dependency:
 *       enrichment:
 *         failure-threshold: 3
 *   eta:
 *     window-size: 10
 *     min-samples: 3
 *   save:
 *     max-concurrency: 1
 *     inter-batch-delay: 700ms
 *   fetch:
 *     timeout: 5m
 *   workflow:
 *     min-content-length: 50
 *     source-soft-limit: 300
 *     source-hard-limit: 500
 *     estimate-batch-size: 5
 *     estimate-seconds-per-batch: 6
 *   shutdown:
 *     await: 10s
 */
@Validated
@ConfigurationProperties(prefix = "extract")
public class ExtractFlowProperties {

    private Timer timer = new Timer();

    private Retry retry = new Retry();

    private Breaker circuitBreaker = new Breaker();

    private Eta eta = new Eta();

    private Save save = new Save();

    private Fetch fetch = new Fetch();

    private Workflow workflow = new Workflow();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class Timer {
        /** 时间轮刻度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量, -1 不限 */
        private long maxPendingTimeouts = -1;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Retry {
        /** 总尝试次数（含首次） */
        private int maxAttempts = 3;

        private Duration baseDelay = Duration.ofSeconds(1);

        private Duration maxDelay = Duration.ofSeconds(10);

        /** 抖动比例 [0,1) */
        private double jitterRatio = 0.2;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
    }

    public static class Breaker {
        private int failureThreshold = 5;

        private Duration resetTimeout = Duration.ofSeconds(30);

        private int successThreshold = 2;

        /** 按依赖名覆盖, 未填写的字段沿用默认 */
        private Map<String, BreakerOverride> perDependency = new LinkedHashMap<>();

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getResetTimeout() { return resetTimeout; }
        public void setResetTimeout(Duration resetTimeout) { this.resetTimeout = resetTimeout; }
        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }
        public Map<String, BreakerOverride> getPerDependency() { return perDependency; }
        public void setPerDependency(Map<String, BreakerOverride> perDependency) { this.perDependency = perDependency; }
    }

    public static class BreakerOverride {
        private Integer failureThreshold;

        private Duration resetTimeout;

        private Integer successThreshold;

        public Integer getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(Integer failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getResetTimeout() { return resetTimeout; }
        public void setResetTimeout(Duration resetTimeout) { this.resetTimeout = resetTimeout; }
        public Integer getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(Integer successThreshold) { this.successThreshold = successThreshold; }
    }

    public static class Eta {
        /** 滑动窗口大小 */
        private int windowSize = 10;

        /** 少于该样本数时估算不可信 */
        private int minSamples = 3;

        public int getWindowSize() { return windowSize; }
        public void setWindowSize(int windowSize) { this.windowSize = windowSize; }
        public int getMinSamples() { return minSamples; }
        public void setMinSamples(int minSamples) { this.minSamples = minSamples; }
    }

    public static class Save {
        /** 每批条数 */
        private int maxConcurrency = 1;

        /** 批间隔 */
        private Duration interBatchDelay = Duration.ofMillis(700);

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public Duration getInterBatchDelay() { return interBatchDelay; }
        public void setInterBatchDelay(Duration interBatchDelay) { this.interBatchDelay = interBatchDelay; }
    }

    public static class Fetch {
        /** 整批抓取截止时长 */
        private Duration timeout = Duration.ofMinutes(5);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Workflow {
        private int minContentLength = 50;

        private int sourceSoftLimit = 300;

        private int sourceHardLimit = 500;

        private int estimateBatchSize = 5;

        private int estimateSecondsPerBatch = 6;

        public int getMinContentLength() { return minContentLength; }
        public void setMinContentLength(int minContentLength) { this.minContentLength = minContentLength; }
        public int getSourceSoftLimit() { return sourceSoftLimit; }
        public void setSourceSoftLimit(int sourceSoftLimit) { this.sourceSoftLimit = sourceSoftLimit; }
        public int getSourceHardLimit() { return sourceHardLimit; }
        public void setSourceHardLimit(int sourceHardLimit) { this.sourceHardLimit = sourceHardLimit; }
        public int getEstimateBatchSize() { return estimateBatchSize; }
        public void setEstimateBatchSize(int estimateBatchSize) { this.estimateBatchSize = estimateBatchSize; }
        public int getEstimateSecondsPerBatch() { return estimateSecondsPerBatch; }
        public void setEstimateSecondsPerBatch(int estimateSecondsPerBatch) { this.estimateSecondsPerBatch = estimateSecondsPerBatch; }
    }

    public static class Shutdown {
        /** 停机时记录的在途等待上限 */
        private Duration await = Duration.ofSeconds(10);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Timer getTimer() { return timer; }
    public void setTimer(Timer timer) { this.timer = timer; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Breaker getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(Breaker circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public Eta getEta() { return eta; }
    public void setEta(Eta eta) { this.eta = eta; }

    public Save getSave() { return save; }
    public void setSave(Save save) { this.save = save; }

    public Fetch getFetch() { return fetch; }
    public void setFetch(Fetch fetch) { this.fetch = fetch; }

    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }
}
