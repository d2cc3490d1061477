package com.fastextract.core.notify;

import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.spi.notify.Notifier;
import com.fastextract.model.ctx.NotifyContext;
import com.fastextract.model.enums.NotifyEventType;
import com.fastextract.model.enums.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AsyncNotifyingServiceTest {

    private SimpleMeterRegistry registry;
    private ExtractMetrics metrics;
    private ExecutorService exec;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = ExtractMetrics.create(registry);
        exec = Executors.newSingleThreadExecutor();
    }

    @Test
    void fire_deliversToSupportingNotifiersOnly() {
        RecordingNotifier all = new RecordingNotifier("all", null);
        RecordingNotifier timeoutsOnly = new RecordingNotifier("timeouts", NotifyEventType.FETCH_TIMEOUT);
        AsyncNotifyingService service = new AsyncNotifyingService(exec, List.of(all, timeoutsOnly), null, metrics, 1);

        service.fire(ctx(NotifyEventType.CIRCUIT_OPENED), Severity.ERROR);
        service.fire(ctx(NotifyEventType.FETCH_TIMEOUT), Severity.WARNING);
        assertThat(service.shutdown(Duration.ofSeconds(5))).isTrue();

        assertThat(all.received).containsExactly(NotifyEventType.CIRCUIT_OPENED, NotifyEventType.FETCH_TIMEOUT);
        assertThat(timeoutsOnly.received).containsExactly(NotifyEventType.FETCH_TIMEOUT);
        assertThat(registry.get("extract.notify.sent").counter().count()).isEqualTo(3.0);
    }

    @Test
    void fire_retriesFlakyChannelBeforeGivingUp() {
        AtomicInteger flakyCalls = new AtomicInteger();
        Notifier flaky = new Notifier() {
            @Override
            public String name() {
                return "flaky";
            }

            @Override
            public void notify(NotifyContext ctx, Severity severity) {
                if (flakyCalls.incrementAndGet() < 3) {
                    throw new IllegalStateException("webhook down");
                }
            }
        };
        AtomicInteger brokenCalls = new AtomicInteger();
        Notifier broken = new Notifier() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public void notify(NotifyContext ctx, Severity severity) {
                brokenCalls.incrementAndGet();
                throw new IllegalStateException("always down");
            }
        };
        AsyncNotifyingService service = new AsyncNotifyingService(exec, List.of(flaky, broken), null, metrics, 1);

        service.fire(ctx(NotifyEventType.SAVE_FAILURES), Severity.WARNING);
        service.shutdown(Duration.ofSeconds(5));

        assertThat(flakyCalls).hasValue(3);
        assertThat(brokenCalls).hasValue(AsyncNotifyingService.MAX_DELIVERY_ATTEMPTS);
        assertThat(registry.get("extract.notify.sent").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("extract.notify.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void fire_filteredEvent_isCountedAsSuppressed() {
        RecordingNotifier all = new RecordingNotifier("all", null);
        AsyncNotifyingService service = new AsyncNotifyingService(exec, List.of(all), (c, s) -> s == Severity.ERROR,
                metrics, 1);

        service.fire(ctx(NotifyEventType.SOURCE_LIMIT_WARNING), Severity.WARNING);
        service.shutdown(Duration.ofSeconds(5));

        assertThat(all.received).isEmpty();
        assertThat(registry.get("extract.notify.suppressed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void fire_afterShutdown_isCountedAsFailed() {
        AsyncNotifyingService service = new AsyncNotifyingService(exec, List.of(new RecordingNotifier("all", null)),
                null, metrics, 1);
        service.shutdown(Duration.ofSeconds(1));

        service.fire(ctx(NotifyEventType.WORKFLOW_FAILED), Severity.ERROR);

        assertThat(registry.get("extract.notify.failed").counter().count()).isEqualTo(1.0);
    }

    private static NotifyContext ctx(NotifyEventType type) {
        NotifyContext ctx = new NotifyContext();
        ctx.setType(type);
        ctx.setComponent("test");
        return ctx;
    }

    private static final class RecordingNotifier implements Notifier {
        private final String name;
        private final NotifyEventType only;
        private final List<NotifyEventType> received = new CopyOnWriteArrayList<>();

        private RecordingNotifier(String name, NotifyEventType only) {
            this.name = name;
            this.only = only;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean supports(NotifyContext ctx) {
            return only == null || only == ctx.getType();
        }

        @Override
        public void notify(NotifyContext ctx, Severity severity) {
            received.add(ctx.getType());
        }
    }
}
