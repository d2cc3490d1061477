package com.fastextract.core.notify;

import com.fastextract.core.notify.ratelimit.RateLimitFilter;
import com.fastextract.model.ctx.NotifyContext;
import com.fastextract.model.enums.NotifyEventType;
import com.fastextract.model.enums.Severity;
import com.fastextract.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitFilterTest {

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");

    private final RateLimitFilter filter = new RateLimitFilter(Duration.ofSeconds(30), 2, clock);

    @Test
    void allow_suppressesAboveThresholdWithinWindow() {
        NotifyContext ctx = ctx(NotifyEventType.CIRCUIT_OPENED, "enrichment");

        assertThat(filter.allow(ctx, Severity.ERROR)).isTrue();
        assertThat(filter.allow(ctx, Severity.ERROR)).isTrue();
        assertThat(filter.allow(ctx, Severity.ERROR)).isFalse();
    }

    @Test
    void allow_countsEachEventComponentSeveritySeparately() {
        NotifyContext opened = ctx(NotifyEventType.CIRCUIT_OPENED, "enrichment");
        filter.allow(opened, Severity.ERROR);
        filter.allow(opened, Severity.ERROR);

        assertThat(filter.allow(opened, Severity.WARNING)).isTrue();
        assertThat(filter.allow(ctx(NotifyEventType.CIRCUIT_OPENED, "persistence"), Severity.ERROR)).isTrue();
        assertThat(filter.allow(ctx(NotifyEventType.FETCH_TIMEOUT, "enrichment"), Severity.ERROR)).isTrue();
    }

    @Test
    void allow_resetsAfterWindow() {
        NotifyContext ctx = ctx(NotifyEventType.SAVE_FAILURES, "persistence");
        for (int i = 0; i < 3; i++) {
            filter.allow(ctx, Severity.WARNING);
        }

        clock.advance(Duration.ofSeconds(31));

        assertThat(filter.allow(ctx, Severity.WARNING)).isTrue();
    }

    private static NotifyContext ctx(NotifyEventType type, String component) {
        NotifyContext ctx = new NotifyContext();
        ctx.setType(type);
        ctx.setComponent(component);
        return ctx;
    }
}
