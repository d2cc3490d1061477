package com.fastextract.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class ExtractMetrics {
    private final MeterRegistry registry;
    private final Counter saveSuccess;
    private final Counter saveFailed;
    private final Counter fetchSuccess;
    private final Counter fetchFailed;
    private final Counter retry;
    private final Counter circuitOpened;
    private final Counter circuitRejected;
    private final Counter workflowCompleted;
    private final Counter workflowFailed;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final DistributionSummary preparedSources;

    private ExtractMetrics(MeterRegistry reg) {
        this.registry = reg;
        this.saveSuccess  = Counter.builder("extract.save.success").description("records saved").register(reg);
        this.saveFailed   = Counter.builder("extract.save.failed").description("records failed to save").register(reg);
        this.fetchSuccess = Counter.builder("extract.fetch.success").description("enrichment fetches succeeded").register(reg);
        this.fetchFailed  = Counter.builder("extract.fetch.failed").description("enrichment fetches failed").register(reg);
        this.retry        = Counter.builder("extract.retry").description("retries scheduled").register(reg);
        this.circuitOpened   = Counter.builder("extract.circuit.opened").description("breaker transitions to OPEN").register(reg);
        this.circuitRejected = Counter.builder("extract.circuit.rejected").description("calls rejected by an open breaker").register(reg);
        this.workflowCompleted = Counter.builder("extract.workflow.completed").description("workflows completed").register(reg);
        this.workflowFailed    = Counter.builder("extract.workflow.failed").description("workflows failed or cancelled").register(reg);
        this.notifySuppressed = Counter.builder("extract.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent   = Counter.builder("extract.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("extract.notify.failed").description("notify failed").register(reg);
        this.preparedSources = DistributionSummary.builder("extract.workflow.sources")
                .description("sources kept per workflow").baseUnit("sources").register(reg);
    }

    public static ExtractMetrics create(MeterRegistry reg) { return new ExtractMetrics(reg); }

    public void incSaveSuccess(){ saveSuccess.increment(); }
    public void incSaveFailed(){  saveFailed.increment(); }
    public void incFetchSuccess(){ fetchSuccess.increment(); }
    public void incFetchFailed(){  fetchFailed.increment(); }
    public void incRetry(){ retry.increment(); }
    public void incCircuitOpened(){ circuitOpened.increment(); }
    public void incCircuitRejected(){ circuitRejected.increment(); }
    public void incWorkflowCompleted(){ workflowCompleted.increment(); }
    public void incWorkflowFailed(){ workflowFailed.increment(); }
    public void incNotifySuppressed(){ notifySuppressed.increment(); }
    public void incNotifyFailed(){ notifyFailed.increment(); }
    public void incNotifySent(){ notifySent.increment(); }
    public void recordPreparedSources(int n){ preparedSources.record(n); }

    /** 按操作名与结果打点 */
    public void recordOperation(String operation, boolean success, long durationMs) {
        Timer.builder("extract.operation")
                .description("operation duration")
                .tag("operation", operation)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Math.max(0, durationMs), TimeUnit.MILLISECONDS);
    }

    public MeterRegistry getRegistry() { return registry; }
}
