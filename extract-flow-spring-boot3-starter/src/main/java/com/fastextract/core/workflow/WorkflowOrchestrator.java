package com.fastextract.core.workflow;

import com.fastextract.core.cancel.CancellationSignal;
import com.fastextract.core.extract.ExtractionBatchResult;
import com.fastextract.core.extract.ExtractionOptions;
import com.fastextract.core.extract.ExtractionOutcome;
import com.fastextract.core.extract.ParallelExtractionCoordinator;
import com.fastextract.core.failure.NormalizedError;
import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.metric.PerformanceMetricsRecorder;
import com.fastextract.core.notify.NotifyContexts;
import com.fastextract.core.notify.NotifyingFacade;
import com.fastextract.core.save.BatchResult;
import com.fastextract.core.save.BatchSaveCoordinator;
import com.fastextract.core.save.SaveOptions;
import com.fastextract.core.spi.ExtractionClient;
import com.fastextract.exception.ExtractionTimeoutException;
import com.fastextract.exception.ExtractionValidationException;
import com.fastextract.exception.SourceLimitExceededException;
import com.fastextract.exception.WorkflowCancelledException;
import com.fastextract.model.LiteratureRecord;
import com.fastextract.model.enums.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 工作流编排: 保存 -> 抓取全文 -> 准备来源 -> 下游抽取
 * 各阶段进度映射到统一的 0-100: 保存 0-15, 抓取 15-40, 准备 40, 抽取 40-100
 * 来源数量上限只在这一层生效; 无状态, 可并发运行多次
 */
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final BatchSaveCoordinator saveCoordinator;

    private final ParallelExtractionCoordinator extractionCoordinator;

    private final ExtractionClient extractionClient;

    private final SourcePreparer preparer;

    private final WorkflowSettings settings;

    private final PerformanceMetricsRecorder performance;

    private final ExtractMetrics metrics;

    private final NotifyingFacade notifier;

    public WorkflowOrchestrator(BatchSaveCoordinator saveCoordinator,
                                ParallelExtractionCoordinator extractionCoordinator,
                                ExtractionClient extractionClient,
                                WorkflowSettings settings,
                                PerformanceMetricsRecorder performance,
                                ExtractMetrics metrics,
                                NotifyingFacade notifier) {
        this.saveCoordinator = saveCoordinator;
        this.extractionCoordinator = extractionCoordinator;
        this.extractionClient = extractionClient;
        this.settings = settings;
        this.preparer = new SourcePreparer(settings.getMinContentLength());
        this.performance = performance;
        this.metrics = metrics;
        this.notifier = notifier;
    }

    public CompletableFuture<WorkflowResult> runWorkflow(List<LiteratureRecord> records, WorkflowOptions options) {
        WorkflowOptions opts = options == null ? WorkflowOptions.defaults() : options;
        CancellationSignal signal = opts.getSignal() == null ? CancellationSignal.none() : opts.getSignal();
        ProgressTracker tracker = new ProgressTracker(opts.getOnProgress());
        AtomicReference<WorkflowStage> stage = new AtomicReference<>(WorkflowStage.SAVE);
        List<LiteratureRecord> input = records == null ? List.of() : records;

        log.info("[Workflow] start: records={}", input.size());
        CompletableFuture<WorkflowResult> run = performance.time("workflow.total",
                () -> runStages(input, opts, signal, tracker, stage));
        return run.whenComplete((result, err) -> {
            if (err == null) {
                metrics.incWorkflowCompleted();
                log.info("[Workflow] completed: sources={}, warning={}",
                        result.getPreparation().getTotalWithContent(), result.getWarning() != null);
                return;
            }
            metrics.incWorkflowFailed();
            Throwable cause = NormalizedError.unwrap(err);
            if (cause instanceof WorkflowCancelledException || cause instanceof CancellationException) {
                log.info("[Workflow] cancelled during {}", stage.get());
            } else {
                log.error("[Workflow] failed during {}: {}", stage.get(), cause.toString());
                notifier.fire(NotifyContexts.ctxForWorkflowFailed(stage.get().name(), cause), Severity.ERROR);
            }
        });
    }

    private CompletableFuture<WorkflowResult> runStages(List<LiteratureRecord> input, WorkflowOptions opts,
                                                        CancellationSignal signal, ProgressTracker tracker,
                                                        AtomicReference<WorkflowStage> stage) {
        tracker.emit(WorkflowStage.SAVE, 0, input.size(), 0, "Saving records...");
        SaveOptions saveOptions = SaveOptions.builder()
                .signal(signal)
                .onProgress(p -> tracker.emit(WorkflowStage.SAVE, p.getProcessedCount(), p.getTotalItems(),
                        WorkflowStage.SAVE.percentOf(p.getProcessedCount(), p.getTotalItems()),
                        "Saving records... (batch " + p.getBatchNumber() + "/" + p.getTotalBatches()
                                + ", saved " + p.getSavedCount() + "/" + p.getTotalItems() + ")"))
                .build();

        return performance.time("workflow.save", () -> saveCoordinator.batchSave(input, saveOptions))
                .thenCompose(saved -> {
                    stage.set(WorkflowStage.FETCH);
                    return fetch(saved, opts, signal, tracker)
                            .thenCompose(fetched -> {
                                stage.set(WorkflowStage.PREPARE);
                                Prepared prepared = prepare(input, saved, fetched, tracker);
                                stage.set(WorkflowStage.EXTRACT);
                                return extract(prepared, saved, fetched, signal, tracker);
                            });
                });
    }

    private CompletableFuture<FetchStage> fetch(BatchResult saved, WorkflowOptions opts,
                                                CancellationSignal signal, ProgressTracker tracker) {
        Map<String, String> idMapping = saved.getIdMapping();
        int total = idMapping.size();
        tracker.emit(WorkflowStage.FETCH, 0, total, WorkflowStage.FETCH.getFromPercent(),
                "Fetching full text... (0/" + total + ")");
        if (total == 0) {
            return CompletableFuture.completedFuture(new FetchStage(ExtractionBatchResult.empty(), false));
        }
        ExtractionOptions extractionOptions = ExtractionOptions.builder()
                .signal(signal)
                .timeoutMs(opts.getFetchTimeoutMs())
                .onProgress(p -> tracker.emit(WorkflowStage.FETCH, p.getCompleted(), p.getTotal(),
                        WorkflowStage.FETCH.percentOf(p.getCompleted(), p.getTotal()),
                        "Fetching full text... (" + p.getCompleted() + "/" + p.getTotal() + ")"
                                + (p.getEstimatedTimeRemaining() != null ? ", " + p.getEstimatedTimeRemaining() + " remaining" : "")))
                .build();

        return performance.time("workflow.fetch", () -> extractionCoordinator.extractBatch(idMapping, extractionOptions))
                .handle((result, err) -> {
                    if (err == null) {
                        return CompletableFuture.completedFuture(new FetchStage(result, false));
                    }
                    Throwable cause = NormalizedError.unwrap(err);
                    if (cause instanceof ExtractionTimeoutException te && !signal.isCancelled()) {
                        // 超时降级: 保留已完成的富化结果继续
                        log.warn("[Workflow] fetch timed out after {} ms, continuing with {}/{} enriched records",
                                te.getTimeoutMs(), te.getPartialResult().getSuccessCount(), total);
                        return CompletableFuture.completedFuture(new FetchStage(te.getPartialResult(), true));
                    }
                    return CompletableFuture.<FetchStage>failedFuture(cause);
                })
                .thenCompose(f -> f);
    }

    private Prepared prepare(List<LiteratureRecord> input, BatchResult saved, FetchStage fetched,
                             ProgressTracker tracker) {
        List<LiteratureRecord> merged = mergeEnriched(input, saved, fetched.result);
        tracker.emit(WorkflowStage.PREPARE, 0, merged.size(), WorkflowStage.PREPARE.getFromPercent(),
                "Preparing " + merged.size() + " sources...");
        PreparationResult preparation = performance.timeSync("workflow.prepare", () -> preparer.prepare(merged));

        int kept = preparation.getTotalWithContent();
        SourceCountValidation validation = validateSourceCount(kept);
        if (!validation.isValid()) {
            throw new SourceLimitExceededException(validation.getError(), kept, settings.getSourceHardLimit());
        }
        if (validation.getWarning() != null) {
            log.warn("[Workflow] {}", validation.getWarning());
            notifier.fire(NotifyContexts.ctxForSourceLimit(kept, settings.getSourceSoftLimit(),
                    validation.getWarning()), Severity.WARNING);
        }
        if (kept == 0) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("totalSelected", preparation.getTotalSelected());
            ctx.put("totalSkipped", preparation.getTotalSkipped());
            throw new ExtractionValidationException("No sources with sufficient content for extraction", ctx);
        }
        metrics.recordPreparedSources(kept);
        return new Prepared(preparation, validation.getWarning());
    }

    private CompletableFuture<WorkflowResult> extract(Prepared prepared, BatchResult saved, FetchStage fetched,
                                                      CancellationSignal signal, ProgressTracker tracker) {
        if (signal.isCancelled()) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("savedCount", saved.getSavedCount());
            ctx.put("preparedCount", prepared.preparation.getTotalWithContent());
            return CompletableFuture.failedFuture(new WorkflowCancelledException("Workflow cancelled before extraction", ctx));
        }
        List<PreparedSource> sources = prepared.preparation.getSources();
        tracker.emit(WorkflowStage.EXTRACT, 0, sources.size(), WorkflowStage.EXTRACT.getFromPercent(),
                "Extracting from " + sources.size() + " sources...");
        ExtractionClient.StageProgressListener stageListener = (stageNumber, totalStages, message) ->
                tracker.emit(WorkflowStage.EXTRACT, stageNumber, totalStages,
                        WorkflowStage.EXTRACT.percentOf(stageNumber, totalStages),
                        message == null ? "Extracting... (stage " + stageNumber + "/" + totalStages + ")" : message);

        return performance.time("workflow.extract", () -> extractionClient.extract(sources, stageListener))
                .thenApply((JsonNode payload) -> {
                    tracker.emit(WorkflowStage.EXTRACT, sources.size(), sources.size(), 100, "Extraction complete");
                    return WorkflowResult.builder()
                            .payload(payload)
                            .saveResult(saved)
                            .fetchResult(fetched.result)
                            .fetchTimedOut(fetched.timedOut)
                            .preparation(prepared.preparation)
                            .warning(prepared.warning)
                            .build();
                });
    }

    /**
     * 来源数量策略: 超过硬上限无效, 超过软上限给出耗时提示
     */
    public SourceCountValidation validateSourceCount(int n) {
        if (n < 0) {
            return new SourceCountValidation(false, null, "Source count cannot be negative: " + n, 0);
        }
        long batches = (n + settings.getEstimateBatchSize() - 1) / settings.getEstimateBatchSize();
        long seconds = batches * settings.getEstimateSecondsPerBatch();
        if (n > settings.getSourceHardLimit()) {
            return new SourceCountValidation(false, null,
                    "Too many sources selected (" + n + "). Maximum is " + settings.getSourceHardLimit() + ".",
                    seconds);
        }
        if (n > settings.getSourceSoftLimit()) {
            long low = Math.max(1, Math.round(seconds / 60.0));
            long high = Math.max(low + 1, (long) Math.ceil(seconds * 1.5 / 60.0));
            return new SourceCountValidation(true,
                    "Large selection (" + n + " sources): extraction may take about " + low + "-" + high
                            + " minutes.", null, seconds);
        }
        return new SourceCountValidation(true, null, null, seconds);
    }

    /**
     * 仅保留已保存的记录, 有富化结果的用其全文/摘要覆盖
     */
    static List<LiteratureRecord> mergeEnriched(List<LiteratureRecord> input, BatchResult saved,
                                                ExtractionBatchResult fetched) {
        Map<String, LiteratureRecord> enriched = new HashMap<>();
        if (fetched != null) {
            for (ExtractionOutcome o : fetched.getOutcomes()) {
                if (o instanceof ExtractionOutcome.Success s && s.getRecord() != null) {
                    enriched.put(s.getOriginalId(), s.getRecord());
                }
            }
        }
        List<LiteratureRecord> merged = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (LiteratureRecord r : input) {
            if (r == null || r.getId() == null || !saved.getIdMapping().containsKey(r.getId()) || !seen.add(r.getId())) {
                continue;
            }
            LiteratureRecord e = enriched.get(r.getId());
            if (e == null) {
                merged.add(r);
                continue;
            }
            LiteratureRecord.LiteratureRecordBuilder b = r.toBuilder()
                    .fullText(e.getFullText())
                    .hasFullText(e.isHasFullText())
                    .fullTextWordCount(e.getFullTextWordCount())
                    .fullTextStatus(e.getFullTextStatus());
            if (e.getAbstractText() != null && !e.getAbstractText().isBlank()) {
                b.abstractText(e.getAbstractText());
            }
            merged.add(b.build());
        }
        return merged;
    }

    /**
     * 进度单调化; 回调串行执行, 抛出的异常只记录
     */
    private static final class ProgressTracker {
        private final Consumer<WorkflowProgress> listener;
        private int lastPercentage;

        private ProgressTracker(Consumer<WorkflowProgress> listener) {
            this.listener = listener;
        }

        synchronized void emit(WorkflowStage stage, int current, int total, int percentage, String message) {
            int pct = Math.min(100, Math.max(lastPercentage, percentage));
            lastPercentage = pct;
            if (listener == null) {
                return;
            }
            try {
                listener.accept(new WorkflowProgress(stage, stage.getNumber(), WorkflowStage.TOTAL_STAGES,
                        current, total, pct, message));
            } catch (RuntimeException e) {
                log.warn("[Workflow] progress listener threw, ignored: {}", e.toString());
            }
        }
    }

    private static final class FetchStage {
        private final ExtractionBatchResult result;
        private final boolean timedOut;

        private FetchStage(ExtractionBatchResult result, boolean timedOut) {
            this.result = result;
            this.timedOut = timedOut;
        }
    }

    private static final class Prepared {
        private final PreparationResult preparation;
        private final String warning;

        private Prepared(PreparationResult preparation, String warning) {
            this.preparation = preparation;
            this.warning = warning;
        }
    }
}
