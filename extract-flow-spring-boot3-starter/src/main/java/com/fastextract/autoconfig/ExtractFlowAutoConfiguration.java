package com.fastextract.autoconfig;

import com.fastextract.config.ExtractFlowProperties;
import com.fastextract.config.ExtractNotifierProperties;
import com.fastextract.core.ExtractFlowLifecycle;
import com.fastextract.core.backoff.ExponentialJitterBackoffPolicy;
import com.fastextract.core.breaker.BreakerEventPublisher;
import com.fastextract.core.breaker.CircuitBreakerConfig;
import com.fastextract.core.breaker.CircuitBreakerRegistry;
import com.fastextract.core.extract.ParallelExtractionCoordinator;
import com.fastextract.core.failure.ClassificationRule;
import com.fastextract.core.failure.ErrorClassifier;
import com.fastextract.core.guard.DownstreamGuard;
import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.metric.PerformanceMetricsRecorder;
import com.fastextract.core.notify.AsyncNotifyingService;
import com.fastextract.core.notify.NotifyingFacade;
import com.fastextract.core.retry.RetryExecutor;
import com.fastextract.core.retry.RetryPolicy;
import com.fastextract.core.save.BatchSaveCoordinator;
import com.fastextract.core.save.SaveSettings;
import com.fastextract.core.spi.BackoffPolicy;
import com.fastextract.core.spi.EnrichmentClient;
import com.fastextract.core.spi.ExtractionClient;
import com.fastextract.core.spi.PersistenceClient;
import com.fastextract.core.timer.HashedWheelTaskTimer;
import com.fastextract.core.timer.TaskTimer;
import com.fastextract.core.workflow.WorkflowOrchestrator;
import com.fastextract.core.workflow.WorkflowSettings;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 时间轮、重试、熔断及各协调器的装配
 * 协调器仅在使用方提供对应下游客户端时创建
 */
@AutoConfiguration(after = {
        ExtractFlowMetricsAutoConfiguration.class,
        ExtractGuardAutoConfiguration.class,
        ExtractNotifierAutoConfiguration.class
})
@EnableConfigurationProperties({
        ExtractFlowProperties.class,
        ExtractNotifierProperties.class
})
public class ExtractFlowAutoConfiguration {

    /**
     * 时间轮
     */
    @Bean
    @ConditionalOnMissingBean
    public HashedWheelTimer extractWheelTimer(ExtractFlowProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("extract-wheel-timer"),
                props.getTimer().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getTimer().getTicksPerWheel(),
                false,
                props.getTimer().getMaxPendingTimeouts()
        );
    }

    @Bean
    @ConditionalOnMissingBean(TaskTimer.class)
    public HashedWheelTaskTimer extractTaskTimer(HashedWheelTimer wheelTimer) {
        return new HashedWheelTaskTimer(wheelTimer);
    }

    /**
     * 错误分类器, 使用方的 ClassificationRule 优先于内置规则
     */
    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier(ObjectProvider<ClassificationRule> customRules) {
        return new ErrorClassifier(customRules.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean(BackoffPolicy.class)
    public BackoffPolicy extractBackoffPolicy(ExtractFlowProperties props) {
        return new ExponentialJitterBackoffPolicy(props.getRetry().getJitterRatio());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(TaskTimer timer, BackoffPolicy backoff, ExtractMetrics metrics) {
        return new RetryExecutor(timer, backoff, metrics);
    }

    /**
     * 基础重试策略; 协调器在此基础上附加可重试判断
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy extractRetryPolicy(ExtractFlowProperties props) {
        ExtractFlowProperties.Retry r = props.getRetry();
        return RetryPolicy.builder()
                .maxAttempts(r.getMaxAttempts())
                .baseDelayMs(r.getBaseDelay().toMillis())
                .maxDelayMs(r.getMaxDelay().toMillis())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry(ExtractFlowProperties props,
                                                         ExtractMetrics metrics,
                                                         NotifyingFacade notifyingFacade) {
        ExtractFlowProperties.Breaker cb = props.getCircuitBreaker();
        CircuitBreakerConfig defaults = CircuitBreakerConfig.of(cb.getFailureThreshold(),
                cb.getResetTimeout().toMillis(), cb.getSuccessThreshold());
        Map<String, CircuitBreakerConfig> perDependency = new LinkedHashMap<>();
        if (cb.getPerDependency() != null) {
            cb.getPerDependency().forEach((name, o) -> perDependency.put(name, CircuitBreakerConfig.of(
                    o.getFailureThreshold() != null ? o.getFailureThreshold() : defaults.getFailureThreshold(),
                    o.getResetTimeout() != null ? o.getResetTimeout().toMillis() : defaults.getResetTimeoutMs(),
                    o.getSuccessThreshold() != null ? o.getSuccessThreshold() : defaults.getSuccessThreshold())));
        }
        return new CircuitBreakerRegistry(defaults, perDependency, Clock.systemUTC(),
                new BreakerEventPublisher(metrics, notifyingFacade));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(PersistenceClient.class)
    public BatchSaveCoordinator batchSaveCoordinator(PersistenceClient client,
                                                     RetryExecutor retryExecutor,
                                                     RetryPolicy retryPolicy,
                                                     ErrorClassifier classifier,
                                                     DownstreamGuard guard,
                                                     TaskTimer timer,
                                                     ExtractMetrics metrics,
                                                     NotifyingFacade notifyingFacade,
                                                     ExtractFlowProperties props) {
        SaveSettings settings = new SaveSettings(props.getSave().getMaxConcurrency(),
                props.getSave().getInterBatchDelay().toMillis());
        return new BatchSaveCoordinator(client, retryExecutor, retryPolicy, classifier, guard, timer,
                settings, metrics, notifyingFacade);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(EnrichmentClient.class)
    public ParallelExtractionCoordinator parallelExtractionCoordinator(EnrichmentClient client,
                                                                       RetryExecutor retryExecutor,
                                                                       RetryPolicy retryPolicy,
                                                                       ErrorClassifier classifier,
                                                                       CircuitBreakerRegistry breakers,
                                                                       DownstreamGuard guard,
                                                                       TaskTimer timer,
                                                                       ExtractMetrics metrics,
                                                                       NotifyingFacade notifyingFacade,
                                                                       ExtractFlowProperties props) {
        return new ParallelExtractionCoordinator(client, retryExecutor, retryPolicy, classifier, breakers, guard,
                timer, metrics, notifyingFacade, Clock.systemUTC(),
                props.getFetch().getTimeout().toMillis(),
                props.getEta().getWindowSize(),
                props.getEta().getMinSamples());
    }

    /**
     * 工作流编排, 需要三个下游客户端齐全
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({PersistenceClient.class, EnrichmentClient.class, ExtractionClient.class})
    public WorkflowOrchestrator workflowOrchestrator(BatchSaveCoordinator saveCoordinator,
                                                     ParallelExtractionCoordinator extractionCoordinator,
                                                     ExtractionClient extractionClient,
                                                     PerformanceMetricsRecorder performance,
                                                     ExtractMetrics metrics,
                                                     NotifyingFacade notifyingFacade,
                                                     ExtractFlowProperties props) {
        ExtractFlowProperties.Workflow w = props.getWorkflow();
        WorkflowSettings settings = WorkflowSettings.builder()
                .minContentLength(w.getMinContentLength())
                .sourceSoftLimit(w.getSourceSoftLimit())
                .sourceHardLimit(w.getSourceHardLimit())
                .estimateBatchSize(w.getEstimateBatchSize())
                .estimateSecondsPerBatch(w.getEstimateSecondsPerBatch())
                .build();
        return new WorkflowOrchestrator(saveCoordinator, extractionCoordinator, extractionClient, settings,
                performance, metrics, notifyingFacade);
    }

    /**
     * 启动信息与停机清理
     */
    @Bean
    public ExtractFlowLifecycle extractFlowLifecycle(ObjectProvider<HashedWheelTaskTimer> timer,
                                                     ObjectProvider<AsyncNotifyingService> notifyingService,
                                                     ExtractFlowProperties props,
                                                     ExtractNotifierProperties notifyProps) {
        return new ExtractFlowLifecycle(timer.getIfAvailable(), notifyingService.getIfAvailable(), props, notifyProps);
    }
}
