package com.fastextract.core.save;

import com.fastextract.core.cancel.CancellationSignal;
import com.fastextract.core.failure.ErrorClassifier;
import com.fastextract.core.failure.NormalizedError;
import com.fastextract.core.guard.DownstreamGuard;
import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.notify.NotifyContexts;
import com.fastextract.core.notify.NotifyingFacade;
import com.fastextract.core.retry.RetryExecutor;
import com.fastextract.core.retry.RetryPolicy;
import com.fastextract.core.spi.PersistenceClient;
import com.fastextract.core.timer.TaskTimer;
import com.fastextract.core.timer.WheelTask;
import com.fastextract.exception.WorkflowCancelledException;
import com.fastextract.model.LiteratureRecord;
import com.fastextract.model.SaveResponse;
import com.fastextract.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static com.fastextract.core.util.Ids.isBlank;
import static com.fastextract.core.util.Ids.reasonOf;
import static com.fastextract.core.util.Ids.shortId;

/**
 * 批量保存协调器
 * 先校验必填字段与重复 id, 再按 maxConcurrency 切批, 批次严格串行, 批间固定间隔以满足下游限速;
 * 批内并发保存, 单条失败不影响同批其它条目; 每条保存经过 限流/隔离 -> 重试
 */
public class BatchSaveCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchSaveCoordinator.class);

    private final PersistenceClient client;

    private final RetryExecutor retryExecutor;

    private final RetryPolicy basePolicy;

    private final ErrorClassifier classifier;

    private final DownstreamGuard guard;

    private final TaskTimer timer;

    private final SaveSettings settings;

    private final ExtractMetrics metrics;

    private final NotifyingFacade notifier;

    public BatchSaveCoordinator(PersistenceClient client,
                                RetryExecutor retryExecutor,
                                RetryPolicy basePolicy,
                                ErrorClassifier classifier,
                                DownstreamGuard guard,
                                TaskTimer timer,
                                SaveSettings settings,
                                ExtractMetrics metrics,
                                NotifyingFacade notifier) {
        this.client = client;
        this.retryExecutor = retryExecutor;
        this.basePolicy = basePolicy;
        this.classifier = classifier;
        this.guard = guard;
        this.timer = timer;
        this.settings = settings;
        this.metrics = metrics;
        this.notifier = notifier;
    }

    public CompletableFuture<BatchResult> batchSave(List<LiteratureRecord> items, SaveOptions options) {
        if (items == null || items.isEmpty()) {
            return CompletableFuture.completedFuture(BatchResult.empty());
        }
        SaveOptions opts = options == null ? SaveOptions.defaults() : options;
        CancellationSignal signal = opts.getSignal() == null ? CancellationSignal.none() : opts.getSignal();

        Tally tally = new Tally(items.size());
        List<LiteratureRecord> valid = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (LiteratureRecord r : items) {
            String invalid = validate(r);
            if (invalid != null) {
                // 不进入网络调用
                tally.failed(r == null ? null : r.getId(), invalid);
                log.warn("[BatchSave] item {} rejected: {}", shortId(r == null ? null : r.getId()), invalid);
            } else if (!seen.add(r.getId())) {
                tally.skipped();
                log.debug("[BatchSave] duplicate id {} skipped", shortId(r.getId()));
            } else {
                valid.add(r);
            }
        }

        List<List<LiteratureRecord>> batches = partition(valid, settings.getMaxConcurrency());
        RetryPolicy policy = basePolicy.toBuilder()
                .shouldRetry(e -> !signal.isCancelled() && classifier.isRetryable(e))
                .onRetry((attempt, e, delay) -> log.info("[BatchSave] save attempt {} failed, retry in {} ms: {}",
                        attempt, delay, reasonOf(e)))
                .build();

        log.info("[BatchSave] start: total={}, valid={}, batches={}, batchSize={}, interBatchDelay={}ms",
                items.size(), valid.size(), batches.size(), settings.getMaxConcurrency(), settings.getInterBatchDelayMs());

        return runFrom(0, batches, policy, signal, opts, tally)
                .thenApply(v -> finish(tally));
    }

    private CompletableFuture<Void> runFrom(int index, List<List<LiteratureRecord>> batches, RetryPolicy policy,
                                            CancellationSignal signal, SaveOptions opts, Tally tally) {
        if (index >= batches.size()) {
            return CompletableFuture.completedFuture(null);
        }
        // 每个批次开始前检查取消
        if (signal.isCancelled()) {
            Tally.Snapshot s = tally.snapshot();
            log.info("[BatchSave] cancelled before batch {}/{}: saved={}, failed={}, processed={}",
                    index + 1, batches.size(), s.saved, s.failed, s.processed);
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("savedCount", s.saved);
            ctx.put("failedCount", s.failed);
            ctx.put("processedCount", s.processed);
            return CompletableFuture.failedFuture(new WorkflowCancelledException("Batch save cancelled", ctx));
        }

        List<LiteratureRecord> batch = batches.get(index);
        CompletableFuture<?>[] saves = new CompletableFuture<?>[batch.size()];
        for (int i = 0; i < batch.size(); i++) {
            saves[i] = saveOne(batch.get(i), policy, tally);
        }
        return CompletableFuture.allOf(saves).thenCompose(v -> {
            reportProgress(opts, tally, index + 1, batches.size());
            if (index + 1 >= batches.size()) {
                return CompletableFuture.completedFuture(null);
            }
            return timer.delay(WheelTask.Kind.BATCH_PAUSE, settings.getInterBatchDelayMs())
                    .thenCompose(x -> runFrom(index + 1, batches, policy, signal, opts, tally));
        });
    }

    /**
     * 返回的 future 永不失败, 结果记入 tally
     */
    private CompletableFuture<Void> saveOne(LiteratureRecord record, RetryPolicy policy, Tally tally) {
        return retryExecutor.executeWithRetry(
                        () -> guard.execute(DownstreamGuard.PERSISTENCE, () -> client.save(record)), policy)
                .handle((SaveResponse resp, Throwable err) -> {
                    if (err != null) {
                        Throwable cause = NormalizedError.unwrap(err);
                        metrics.incSaveFailed();
                        tally.failed(record.getId(), reasonOf(cause));
                        log.warn("[BatchSave] item {} failed ({}): {}", shortId(record.getId()),
                                classifier.classify(cause).getCategory(), reasonOf(cause));
                    } else if (resp == null || !resp.isSuccess() || isBlank(resp.getId())) {
                        metrics.incSaveFailed();
                        tally.failed(record.getId(), "Save rejected by persistence service");
                        log.warn("[BatchSave] item {} rejected by persistence service", shortId(record.getId()));
                    } else {
                        metrics.incSaveSuccess();
                        tally.saved(record.getId(), resp.getId());
                    }
                    return null;
                });
    }

    private BatchResult finish(Tally tally) {
        BatchResult result = tally.toResult();
        log.info("[BatchSave] done: total={}, saved={}, skipped={}, failed={}",
                result.getTotalCount(), result.getSavedCount(), result.getSkippedCount(), result.getFailedCount());
        if (result.getFailedCount() > 0) {
            notifier.fire(NotifyContexts.ctxForSaveFailures(result.getTotalCount(), result.getSavedCount(),
                    result.getFailedCount(), result.getFailedItems().get(0).getReason()), Severity.WARNING);
        }
        return result;
    }

    private static void reportProgress(SaveOptions opts, Tally tally, int batchNumber, int totalBatches) {
        if (opts.getOnProgress() == null) {
            return;
        }
        Tally.Snapshot s = tally.snapshot();
        try {
            opts.getOnProgress().accept(new BatchSaveProgress(batchNumber, totalBatches,
                    s.processed, s.saved, s.failed, tally.total));
        } catch (RuntimeException e) {
            log.warn("[BatchSave] progress listener threw, ignored: {}", e.toString());
        }
    }

    /**
     * @return 校验失败原因, 合法返回 null
     */
    static String validate(LiteratureRecord r) {
        if (r == null) {
            return "Missing record";
        }
        if (isBlank(r.getId())) {
            return "Missing required field: id";
        }
        if (isBlank(r.getTitle())) {
            return "Missing required field: title";
        }
        return null;
    }

    static <T> List<List<T>> partition(List<T> list, int size) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            out.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return out;
    }

    /**
     * 累计计数, 批内并发完成时加锁
     */
    private static final class Tally {
        private final int total;
        private int saved;
        private int skipped;
        private int failed;
        private final List<FailedItem> failedItems = new ArrayList<>();
        private final Map<String, String> idMapping = new LinkedHashMap<>();

        private Tally(int total) {
            this.total = total;
        }

        synchronized void saved(String originalId, String persistedId) {
            saved++;
            idMapping.put(originalId, persistedId);
        }

        synchronized void failed(String originalId, String reason) {
            failed++;
            failedItems.add(new FailedItem(originalId, reason));
        }

        synchronized void skipped() {
            skipped++;
        }

        synchronized Snapshot snapshot() {
            return new Snapshot(saved, failed, saved + failed + skipped);
        }

        synchronized BatchResult toResult() {
            return BatchResult.builder()
                    .totalCount(total)
                    .savedCount(saved)
                    .skippedCount(skipped)
                    .failedCount(failed)
                    .failedItems(List.copyOf(failedItems))
                    .idMapping(Collections.unmodifiableMap(new LinkedHashMap<>(idMapping)))
                    .build();
        }

        private static final class Snapshot {
            private final int saved;
            private final int failed;
            private final int processed;

            private Snapshot(int saved, int failed, int processed) {
                this.saved = saved;
                this.failed = failed;
                this.processed = processed;
            }
        }
    }
}
