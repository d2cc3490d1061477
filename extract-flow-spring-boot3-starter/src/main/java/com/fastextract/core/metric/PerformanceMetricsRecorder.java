package com.fastextract.core.metric;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * 性能指标记录
 * 维护每个操作的耗时/成功失败/吞吐, 以及堆内存高水位; 同时打到 Micrometer Timer
 */
public class PerformanceMetricsRecorder {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMetricsRecorder.class);

    private final ExtractMetrics metrics;

    private final Clock clock;

    /** 当前堆使用量 */
    private final LongSupplier heapUsed;

    private final ObjectMapper mapper;

    private final ConcurrentHashMap<String, Accumulator> operations = new ConcurrentHashMap<>();

    private final AtomicLong memoryHighWater = new AtomicLong();

    public PerformanceMetricsRecorder(ExtractMetrics metrics) {
        this(metrics, Clock.systemUTC(), PerformanceMetricsRecorder::runtimeHeapUsed);
    }

    public PerformanceMetricsRecorder(ExtractMetrics metrics, Clock clock, LongSupplier heapUsed) {
        this.metrics = metrics;
        this.clock = clock;
        this.heapUsed = heapUsed;
        this.mapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void record(String operation, long durationMs, boolean success) {
        long duration = Math.max(0, durationMs);
        long endMs = clock.millis();
        operations.computeIfAbsent(operation, k -> new Accumulator()).add(duration, success, endMs);
        if (metrics != null) {
            metrics.recordOperation(operation, success, duration);
        }
        sampleMemory();
    }

    /**
     * 对异步操作计时, 完成（成功或失败）时记录
     */
    public <T> CompletableFuture<T> time(String operation, Supplier<CompletableFuture<T>> call) {
        long start = clock.millis();
        CompletableFuture<T> f;
        try {
            f = call.get();
        } catch (RuntimeException e) {
            record(operation, clock.millis() - start, false);
            throw e;
        }
        return f.whenComplete((v, err) -> record(operation, clock.millis() - start, err == null));
    }

    /**
     * 对同步操作计时, 抛出视为失败
     */
    public <T> T timeSync(String operation, Supplier<T> call) {
        long start = clock.millis();
        boolean success = false;
        try {
            T value = call.get();
            success = true;
            return value;
        } finally {
            record(operation, clock.millis() - start, success);
        }
    }

    public PerformanceReport snapshot() {
        List<OperationStats> stats = new ArrayList<>();
        long total = 0;
        long failed = 0;
        for (Map.Entry<String, Accumulator> e : operations.entrySet()) {
            OperationStats s = e.getValue().toStats(e.getKey());
            stats.add(s);
            total += s.getCount();
            failed += s.getFailureCount();
        }
        stats.sort(Comparator.comparing(OperationStats::getName));
        return PerformanceReport.builder()
                .generatedAt(Instant.now(clock))
                .operations(List.copyOf(stats))
                .memoryHighWaterBytes(memoryHighWater.get())
                .overallRating(rate(total, failed))
                .build();
    }

    public String exportJson() {
        try {
            return mapper.writeValueAsString(snapshot());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("performance report serialization failed", e);
        }
    }

    public void reset() {
        operations.clear();
        memoryHighWater.set(0);
        log.debug("[Perf] metrics reset");
    }

    static String rate(long total, long failed) {
        if (total == 0) {
            return PerformanceReport.RATING_GOOD;
        }
        double ratio = (double) failed / total;
        if (ratio <= 0.05) {
            return PerformanceReport.RATING_GOOD;
        }
        if (ratio <= 0.25) {
            return PerformanceReport.RATING_NEEDS_IMPROVEMENT;
        }
        return PerformanceReport.RATING_POOR;
    }

    private void sampleMemory() {
        long used;
        try {
            used = heapUsed.getAsLong();
        } catch (RuntimeException e) {
            log.debug("[Perf] heap sampling failed: {}", e.toString());
            return;
        }
        memoryHighWater.accumulateAndGet(used, Math::max);
    }

    private static long runtimeHeapUsed() {
        Runtime rt = Runtime.getRuntime();
        return rt.totalMemory() - rt.freeMemory();
    }

    private static final class Accumulator {
        private long count;
        private long success;
        private long failure;
        private long totalMs;
        private long minMs = Long.MAX_VALUE;
        private long maxMs;
        private long firstStartMs = Long.MAX_VALUE;
        private long lastEndMs;

        synchronized void add(long duration, boolean ok, long endMs) {
            count++;
            if (ok) {
                success++;
            } else {
                failure++;
            }
            totalMs += duration;
            minMs = Math.min(minMs, duration);
            maxMs = Math.max(maxMs, duration);
            firstStartMs = Math.min(firstStartMs, endMs - duration);
            lastEndMs = Math.max(lastEndMs, endMs);
        }

        synchronized OperationStats toStats(String name) {
            long elapsed = Math.max(1, lastEndMs - firstStartMs);
            return OperationStats.builder()
                    .name(name)
                    .count(count)
                    .successCount(success)
                    .failureCount(failure)
                    .totalMs(totalMs)
                    .minMs(count == 0 ? 0 : minMs)
                    .maxMs(maxMs)
                    .averageMs(count == 0 ? 0 : (double) totalMs / count)
                    .throughputPerSecond(count * 1000.0 / elapsed)
                    .build();
        }
    }
}
