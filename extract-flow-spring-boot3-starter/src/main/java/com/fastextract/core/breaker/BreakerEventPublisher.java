package com.fastextract.core.breaker;

import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.notify.NotifyContexts;
import com.fastextract.core.notify.NotifyingFacade;
import com.fastextract.model.enums.NotifyEventType;
import com.fastextract.model.enums.Severity;

/**
 * 熔断状态迁移 -> 指标 + 通知
 */
public class BreakerEventPublisher implements CircuitStateListener {

    private final ExtractMetrics metrics;

    private final NotifyingFacade notifier;

    public BreakerEventPublisher(ExtractMetrics metrics, NotifyingFacade notifier) {
        this.metrics = metrics;
        this.notifier = notifier;
    }

    @Override
    public void onTransition(CircuitState from, CircuitState to, CircuitBreakerStats stats) {
        NotifyEventType type;
        Severity sev;
        switch (to) {
            case OPEN -> {
                metrics.incCircuitOpened();
                type = NotifyEventType.CIRCUIT_OPENED;
                sev = Severity.ERROR;
            }
            case HALF_OPEN -> {
                type = NotifyEventType.CIRCUIT_HALF_OPEN;
                sev = Severity.WARNING;
            }
            default -> {
                type = NotifyEventType.CIRCUIT_CLOSED;
                sev = Severity.INFO;
            }
        }
        notifier.fire(NotifyContexts.ctxForCircuitTransition(stats.getName(), type,
                stats.getNextAttemptTime()), sev);
    }

    @Override
    public void onRejected(CircuitBreakerStats stats) {
        metrics.incCircuitRejected();
    }
}
