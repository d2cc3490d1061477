package com.fastextract.core.metric;

import com.fastextract.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PerformanceMetricsRecorderTest {

    private MutableClock clock;
    private AtomicLong heap;
    private SimpleMeterRegistry registry;
    private PerformanceMetricsRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        heap = new AtomicLong(1_000);
        registry = new SimpleMeterRegistry();
        recorder = new PerformanceMetricsRecorder(ExtractMetrics.create(registry), clock, heap::get);
    }

    @Test
    void record_aggregatesPerOperation() {
        clock.advanceMillis(100);
        recorder.record("save", 100, true);
        clock.advanceMillis(300);
        recorder.record("save", 300, false);
        recorder.record("fetch", 50, true);

        PerformanceReport report = recorder.snapshot();

        assertThat(report.getOperations()).extracting(OperationStats::getName).containsExactly("fetch", "save");
        OperationStats save = report.getOperations().get(1);
        assertThat(save.getCount()).isEqualTo(2);
        assertThat(save.getSuccessCount()).isEqualTo(1);
        assertThat(save.getFailureCount()).isEqualTo(1);
        assertThat(save.getMinMs()).isEqualTo(100);
        assertThat(save.getMaxMs()).isEqualTo(300);
        assertThat(save.getAverageMs()).isEqualTo(200.0);
        // 两次记录覆盖 400ms
        assertThat(save.getThroughputPerSecond()).isCloseTo(5.0, within(0.001));
        assertThat(registry.get("extract.operation").tag("operation", "save").tag("outcome", "failure")
                .timer().count()).isEqualTo(1);
    }

    @Test
    void snapshot_ratesByFailureRatio() {
        assertThat(recorder.snapshot().getOverallRating()).isEqualTo(PerformanceReport.RATING_GOOD);

        for (int i = 0; i < 9; i++) {
            recorder.record("op", 10, true);
        }
        recorder.record("op", 10, false);
        assertThat(recorder.snapshot().getOverallRating()).isEqualTo(PerformanceReport.RATING_NEEDS_IMPROVEMENT);

        for (int i = 0; i < 3; i++) {
            recorder.record("op", 10, false);
        }
        assertThat(recorder.snapshot().getOverallRating()).isEqualTo(PerformanceReport.RATING_POOR);
    }

    @Test
    void rate_thresholdsAreInclusive() {
        assertThat(PerformanceMetricsRecorder.rate(20, 1)).isEqualTo(PerformanceReport.RATING_GOOD);
        assertThat(PerformanceMetricsRecorder.rate(4, 1)).isEqualTo(PerformanceReport.RATING_NEEDS_IMPROVEMENT);
        assertThat(PerformanceMetricsRecorder.rate(3, 1)).isEqualTo(PerformanceReport.RATING_POOR);
    }

    @Test
    void time_recordsAsyncOutcome() {
        CompletableFuture<String> pending = new CompletableFuture<>();

        CompletableFuture<String> f = recorder.time("fetch", () -> pending);
        clock.advanceMillis(250);
        pending.completeExceptionally(new IllegalStateException("boom"));

        assertThat(f).isCompletedExceptionally();
        OperationStats stats = recorder.snapshot().getOperations().get(0);
        assertThat(stats.getFailureCount()).isEqualTo(1);
        assertThat(stats.getTotalMs()).isEqualTo(250);
    }

    @Test
    void time_synchronousThrow_isRecordedAndRethrown() {
        assertThatThrownBy(() -> recorder.time("save", () -> {
            throw new IllegalArgumentException("bad input");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(recorder.snapshot().getOperations().get(0).getFailureCount()).isEqualTo(1);
    }

    @Test
    void timeSync_usesRecorderClock() {
        String value = recorder.timeSync("prepare", () -> {
            clock.advanceMillis(40);
            return "ok";
        });

        assertThat(value).isEqualTo("ok");
        OperationStats stats = recorder.snapshot().getOperations().get(0);
        assertThat(stats.getSuccessCount()).isEqualTo(1);
        assertThat(stats.getTotalMs()).isEqualTo(40);
    }

    @Test
    void timeSync_throw_isRecordedAsFailure() {
        assertThatThrownBy(() -> recorder.timeSync("prepare", () -> {
            clock.advanceMillis(15);
            throw new IllegalStateException("broken source");
        })).isInstanceOf(IllegalStateException.class);

        OperationStats stats = recorder.snapshot().getOperations().get(0);
        assertThat(stats.getFailureCount()).isEqualTo(1);
        assertThat(stats.getTotalMs()).isEqualTo(15);
    }

    @Test
    void snapshot_tracksMemoryHighWater() {
        recorder.record("op", 1, true);
        heap.set(5_000);
        recorder.record("op", 1, true);
        heap.set(2_000);
        recorder.record("op", 1, true);

        assertThat(recorder.snapshot().getMemoryHighWaterBytes()).isEqualTo(5_000);
    }

    @Test
    void exportJson_writesIsoTimestampAndOperations() throws Exception {
        recorder.record("save", 42, true);

        JsonNode json = new ObjectMapper().readTree(recorder.exportJson());

        assertThat(json.get("generatedAt").asText()).isEqualTo("2026-01-01T00:00:00Z");
        assertThat(json.get("overallRating").asText()).isEqualTo("good");
        assertThat(json.get("operations").get(0).get("name").asText()).isEqualTo("save");
        assertThat(json.get("operations").get(0).get("totalMs").asLong()).isEqualTo(42);
    }

    @Test
    void reset_clearsEverything() {
        recorder.record("op", 10, true);

        recorder.reset();

        PerformanceReport report = recorder.snapshot();
        assertThat(report.getOperations()).isEmpty();
        assertThat(report.getMemoryHighWaterBytes()).isZero();
    }
}
