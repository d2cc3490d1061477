package com.fastextract.core.extract;

import com.fastextract.core.breaker.CircuitBreaker;
import com.fastextract.core.breaker.CircuitBreakerRegistry;
import com.fastextract.core.cancel.CancellationController;
import com.fastextract.core.cancel.CancellationSignal;
import com.fastextract.core.eta.EtaEstimate;
import com.fastextract.core.eta.EtaEstimator;
import com.fastextract.core.failure.ErrorClassifier;
import com.fastextract.core.failure.NormalizedError;
import com.fastextract.core.guard.DownstreamGuard;
import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.notify.NotifyContexts;
import com.fastextract.core.notify.NotifyingFacade;
import com.fastextract.core.retry.RetryExecutor;
import com.fastextract.core.retry.RetryPolicy;
import com.fastextract.core.spi.EnrichmentClient;
import com.fastextract.core.timer.TaskTimer;
import com.fastextract.core.timer.WheelTask;
import com.fastextract.exception.ExtractionTimeoutException;
import com.fastextract.exception.ExtractionValidationException;
import com.fastextract.exception.InvalidConfigurationException;
import com.fastextract.exception.WorkflowCancelledException;
import com.fastextract.exception.guard.CircuitOpenException;
import com.fastextract.model.LiteratureRecord;
import com.fastextract.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static com.fastextract.core.util.Ids.isBlank;
import static com.fastextract.core.util.Ids.reasonOf;
import static com.fastextract.core.util.Ids.shortId;

/**
 * 并行富化抓取协调器
 * 每条输入并发执行 重试(熔断(限流/隔离(抓取))), 调用前后检查组合取消信号（调用方信号 或 内部超时信号）;
 * 超时只打标记, 不中断在途调用, 所有条目结束后再决定返回结果、超时或取消
 */
public class ParallelExtractionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ParallelExtractionCoordinator.class);

    private final EnrichmentClient client;

    private final RetryExecutor retryExecutor;

    private final RetryPolicy basePolicy;

    private final ErrorClassifier classifier;

    private final CircuitBreakerRegistry breakers;

    private final DownstreamGuard guard;

    private final TaskTimer timer;

    private final ExtractMetrics metrics;

    private final NotifyingFacade notifier;

    private final Clock clock;

    private final long defaultTimeoutMs;

    private final int etaWindowSize;

    private final int etaMinSamples;

    public ParallelExtractionCoordinator(EnrichmentClient client,
                                         RetryExecutor retryExecutor,
                                         RetryPolicy basePolicy,
                                         ErrorClassifier classifier,
                                         CircuitBreakerRegistry breakers,
                                         DownstreamGuard guard,
                                         TaskTimer timer,
                                         ExtractMetrics metrics,
                                         NotifyingFacade notifier,
                                         Clock clock,
                                         long defaultTimeoutMs,
                                         int etaWindowSize,
                                         int etaMinSamples) {
        if (defaultTimeoutMs <= 0) {
            throw new InvalidConfigurationException("defaultTimeoutMs must be > 0, got " + defaultTimeoutMs);
        }
        // 提前校验 ETA 参数
        new EtaEstimator(etaWindowSize, etaMinSamples);
        this.client = client;
        this.retryExecutor = retryExecutor;
        this.basePolicy = basePolicy;
        this.classifier = classifier;
        this.breakers = breakers;
        this.guard = guard;
        this.timer = timer;
        this.metrics = metrics;
        this.notifier = notifier;
        this.clock = clock;
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.etaWindowSize = etaWindowSize;
        this.etaMinSamples = etaMinSamples;
    }

    /**
     * @param idMap originalId -> persistedId
     */
    public CompletableFuture<ExtractionBatchResult> extractBatch(Map<String, String> idMap, ExtractionOptions options) {
        if (idMap == null || idMap.isEmpty()) {
            return CompletableFuture.completedFuture(ExtractionBatchResult.empty());
        }
        for (Map.Entry<String, String> e : idMap.entrySet()) {
            if (isBlank(e.getKey()) || isBlank(e.getValue())) {
                Map<String, Object> ctx = new LinkedHashMap<>();
                ctx.put("originalId", e.getKey());
                ctx.put("persistedId", e.getValue());
                return CompletableFuture.failedFuture(
                        new ExtractionValidationException("Invalid id mapping: ids must be non-empty strings", ctx));
            }
        }
        ExtractionOptions opts = options == null ? ExtractionOptions.defaults() : options;
        long timeoutMs = opts.getTimeoutMs() == null ? defaultTimeoutMs : opts.getTimeoutMs();
        if (timeoutMs <= 0) {
            return CompletableFuture.failedFuture(
                    new InvalidConfigurationException("timeoutMs must be > 0, got " + timeoutMs));
        }

        List<String> originalIds = new ArrayList<>(idMap.keySet());
        int total = originalIds.size();
        CancellationSignal userSignal = opts.getSignal() == null ? CancellationSignal.none() : opts.getSignal();
        CancellationController timeoutController = new CancellationController();

        Run run = new Run(total, new EtaEstimator(etaWindowSize, etaMinSamples), opts.getOnProgress());
        AtomicInteger completedBeforeTimeout = new AtomicInteger(-1);
        AtomicInteger completedBeforeCancellation = new AtomicInteger(-1);

        TaskTimer.ScheduledHandle deadline;
        try {
            deadline = timer.schedule(WheelTask.Kind.DEADLINE, () -> {
                completedBeforeTimeout.set(run.completed());
                log.warn("[Extraction] deadline of {} ms reached with {}/{} completed, waiting for in-flight items",
                        timeoutMs, completedBeforeTimeout.get(), total);
                timeoutController.cancel();
            }, timeoutMs);
        } catch (RuntimeException e) {
            log.warn("[Extraction] cannot schedule deadline, batch of {} not started: {}", total, e.toString());
            return CompletableFuture.failedFuture(e);
        }

        // 两个回调都挂在调用方信号上, 批次结束即摘除
        CancellationSignal.LinkedSignal combined = CancellationSignal.anyOf(userSignal, timeoutController.signal());
        CancellationSignal.Registration cancelSnapshot =
                userSignal.onCancel(() -> completedBeforeCancellation.compareAndSet(-1, run.completed()));

        CircuitBreaker breaker = breakers.get(DownstreamGuard.ENRICHMENT);
        RetryPolicy policy = basePolicy.toBuilder()
                .shouldRetry(e -> !combined.isCancelled()
                        && !(e instanceof CircuitOpenException)
                        && classifier.isRetryable(e))
                .onRetry((attempt, e, delay) -> log.debug("[Extraction] fetch attempt {} failed, retry in {} ms: {}",
                        attempt, delay, reasonOf(e)))
                .build();

        log.info("[Extraction] start: items={}, timeout={} ms, breaker={}", total, timeoutMs, breaker.getState());

        CompletableFuture<?>[] items = new CompletableFuture<?>[total];
        for (int i = 0; i < total; i++) {
            String originalId = originalIds.get(i);
            items[i] = extractOne(i, originalId, idMap.get(originalId), breaker, policy, combined, run);
        }

        return CompletableFuture.allOf(items).thenCompose(v -> {
            deadline.cancel();
            cancelSnapshot.unregister();
            combined.close();
            ExtractionBatchResult result = run.toResult(originalIds);
            boolean timedOut = timeoutController.isCancelled() && !userSignal.isCancelled();
            if (timedOut) {
                return CompletableFuture.failedFuture(timeoutError(result, timeoutMs, completedBeforeTimeout.get()));
            }
            if (userSignal.isCancelled()) {
                log.info("[Extraction] cancelled: success={}, failed={}, total={}",
                        result.getSuccessCount(), result.getFailedCount(), total);
                Map<String, Object> ctx = new LinkedHashMap<>();
                ctx.put("totalCount", total);
                ctx.put("successCount", result.getSuccessCount());
                ctx.put("failedCount", result.getFailedCount());
                ctx.put("completedBeforeCancellation", Math.max(0, completedBeforeCancellation.get()));
                return CompletableFuture.failedFuture(new WorkflowCancelledException("Extraction cancelled", ctx));
            }
            log.info("[Extraction] done: success={}, failed={}, total={}",
                    result.getSuccessCount(), result.getFailedCount(), total);
            return CompletableFuture.completedFuture(result);
        });
    }

    /**
     * 返回的 future 永不失败, 结果记入 run
     */
    private CompletableFuture<Void> extractOne(int index, String originalId, String persistedId,
                                               CircuitBreaker breaker, RetryPolicy policy,
                                               CancellationSignal combined, Run run) {
        long start = clock.millis();
        CompletableFuture<LiteratureRecord> call;
        if (combined.isCancelled()) {
            call = CompletableFuture.failedFuture(aborted());
        } else {
            call = retryExecutor.executeWithRetry(() -> {
                        if (combined.isCancelled()) {
                            return CompletableFuture.failedFuture(aborted());
                        }
                        return breaker.execute(() -> guard.execute(DownstreamGuard.ENRICHMENT,
                                () -> client.fetchEnrichedContent(persistedId)));
                    }, policy)
                    .thenCompose(rec -> combined.isCancelled()
                            ? CompletableFuture.failedFuture(aborted())
                            : CompletableFuture.completedFuture(rec));
        }
        return call.handle((rec, err) -> {
            ExtractionOutcome outcome;
            if (err == null && rec != null) {
                metrics.incFetchSuccess();
                outcome = ExtractionOutcome.success(originalId, rec);
            } else {
                Throwable cause = err == null ? null : NormalizedError.unwrap(err);
                String reason = cause == null ? "Empty enrichment response" : reasonOf(cause);
                metrics.incFetchFailed();
                outcome = ExtractionOutcome.failure(originalId, persistedId, reason);
                if (cause instanceof CancellationException) {
                    log.debug("[Extraction] item {} aborted", shortId(originalId));
                } else {
                    log.warn("[Extraction] item {} failed ({}): {}", shortId(originalId),
                            cause == null ? "EMPTY" : classifier.classify(cause).getCategory(), reason);
                }
            }
            run.settle(index, outcome, start, clock.millis());
            return null;
        });
    }

    private ExtractionTimeoutException timeoutError(ExtractionBatchResult partial, long timeoutMs, int completedBeforeTimeout) {
        int before = Math.max(0, completedBeforeTimeout);
        log.error("[Extraction] timed out after {} ms: completedBeforeTimeout={}, success={}, failed={}, total={}",
                timeoutMs, before, partial.getSuccessCount(), partial.getFailedCount(), partial.getTotalCount());
        notifier.fire(NotifyContexts.ctxForFetchTimeout(timeoutMs, partial.getTotalCount(), before), Severity.WARNING);
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("timeoutMs", timeoutMs);
        ctx.put("totalCount", partial.getTotalCount());
        ctx.put("successCount", partial.getSuccessCount());
        ctx.put("failedCount", partial.getFailedCount());
        ctx.put("completedBeforeTimeout", before);
        return new ExtractionTimeoutException(
                "Extraction timed out after " + timeoutMs + " ms (" + before + "/" + partial.getTotalCount()
                        + " completed before the deadline)", ctx, partial);
    }

    private static CancellationException aborted() {
        return new CancellationException("Extraction aborted");
    }

    /**
     * 单次 extractBatch 的共享状态; 计数、ETA、进度回调在同一把锁内完成, 快照不会撕裂
     */
    private static final class Run {
        private final int total;
        private final EtaEstimator eta;
        private final Consumer<ExtractionProgress> onProgress;
        private final ExtractionOutcome[] outcomes;
        private int completed;
        private int success;
        private int failed;

        private Run(int total, EtaEstimator eta, Consumer<ExtractionProgress> onProgress) {
            this.total = total;
            this.eta = eta;
            this.onProgress = onProgress;
            this.outcomes = new ExtractionOutcome[total];
        }

        synchronized int completed() {
            return completed;
        }

        synchronized void settle(int index, ExtractionOutcome outcome, long startMs, long endMs) {
            if (outcomes[index] != null) {
                return;
            }
            outcomes[index] = outcome;
            completed++;
            if (outcome.isSuccess()) {
                success++;
            } else {
                failed++;
            }
            eta.recordCompletion(startMs, endMs);
            if (onProgress == null) {
                return;
            }
            EtaEstimate estimate = eta.getEstimate(completed, total);
            ExtractionProgress progress = new ExtractionProgress(completed, total,
                    (int) Math.round(completed * 100.0 / total),
                    estimate.isReliable() ? estimate.getFormatted() : null,
                    estimate.isReliable() ? estimate.getAverageTaskMs() : null);
            try {
                onProgress.accept(progress);
            } catch (RuntimeException e) {
                log.warn("[Extraction] progress listener threw, ignored: {}", e.toString());
            }
        }

        synchronized ExtractionBatchResult toResult(List<String> originalIds) {
            List<LiteratureRecord> records = new ArrayList<>();
            List<String> failedIds = new ArrayList<>();
            List<ExtractionOutcome> ordered = new ArrayList<>();
            for (int i = 0; i < outcomes.length; i++) {
                ExtractionOutcome o = outcomes[i];
                if (o == null) {
                    continue;
                }
                ordered.add(o);
                if (o instanceof ExtractionOutcome.Success s) {
                    records.add(s.getRecord());
                } else {
                    failedIds.add(originalIds.get(i));
                }
            }
            return ExtractionBatchResult.builder()
                    .totalCount(total)
                    .successCount(success)
                    .failedCount(failed)
                    .updatedRecords(List.copyOf(records))
                    .failedIds(List.copyOf(failedIds))
                    .outcomes(List.copyOf(ordered))
                    .build();
        }
    }
}
