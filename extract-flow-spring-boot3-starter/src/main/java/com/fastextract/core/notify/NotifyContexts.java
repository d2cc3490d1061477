package com.fastextract.core.notify;

import com.fastextract.model.ctx.NotifyContext;
import com.fastextract.model.enums.NotifyEventType;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    /* ========== 对外入口（系统 UTC 时钟） ========== */

    public static NotifyContext ctxForCircuitTransition(String breakerName, NotifyEventType type,
                                                        Instant nextAttemptTime) {
        return ctxForCircuitTransition(breakerName, type, nextAttemptTime, Clock.systemUTC());
    }

    public static NotifyContext ctxForSaveFailures(int total, int saved, int failed, String firstReason) {
        return ctxForSaveFailures(total, saved, failed, firstReason, Clock.systemUTC());
    }

    public static NotifyContext ctxForFetchTimeout(long timeoutMs, int total, int completedBeforeTimeout) {
        return ctxForFetchTimeout(timeoutMs, total, completedBeforeTimeout, Clock.systemUTC());
    }

    public static NotifyContext ctxForSourceLimit(int sourceCount, int softLimit, String warning) {
        return ctxForSourceLimit(sourceCount, softLimit, warning, Clock.systemUTC());
    }

    public static NotifyContext ctxForWorkflowFailed(String stage, Throwable e) {
        return ctxForWorkflowFailed(stage, e, Clock.systemUTC());
    }

    /* ========== 带 Clock 的重载（方便测试） ========== */

    public static NotifyContext ctxForCircuitTransition(String breakerName, NotifyEventType type,
                                                        Instant nextAttemptTime, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (nextAttemptTime != null) {
            attrs.put("nextAttemptTime", nextAttemptTime.toString());
        }
        return new NotifyContext(type, breakerName, type.name(), null, Instant.now(clock), attrs);
    }

    public static NotifyContext ctxForSaveFailures(int total, int saved, int failed, String firstReason, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("totalCount", total);
        attrs.put("savedCount", saved);
        attrs.put("failedCount", failed);
        return new NotifyContext(NotifyEventType.SAVE_FAILURES, "persistence", "SAVE_FAILED",
                truncate(firstReason), Instant.now(clock), attrs);
    }

    public static NotifyContext ctxForFetchTimeout(long timeoutMs, int total, int completedBeforeTimeout, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("timeoutMs", timeoutMs);
        attrs.put("totalCount", total);
        attrs.put("completedBeforeTimeout", completedBeforeTimeout);
        return new NotifyContext(NotifyEventType.FETCH_TIMEOUT, "enrichment", "TIMEOUT",
                null, Instant.now(clock), attrs);
    }

    public static NotifyContext ctxForSourceLimit(int sourceCount, int softLimit, String warning, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("sourceCount", sourceCount);
        attrs.put("softLimit", softLimit);
        return new NotifyContext(NotifyEventType.SOURCE_LIMIT_WARNING, "workflow", "SOFT_LIMIT",
                warning, Instant.now(clock), attrs);
    }

    public static NotifyContext ctxForWorkflowFailed(String stage, Throwable e, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("stage", stage);
        return new NotifyContext(NotifyEventType.WORKFLOW_FAILED, "workflow",
                e == null ? "UNKNOWN" : e.getClass().getSimpleName(),
                truncate(toError(e)), Instant.now(clock), attrs);
    }

    /* ========== 私有工具 ========== */

    private static String toError(Throwable e) {
        if (e == null) return null;
        String msg = e.getClass().getName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        StringBuilder sb = new StringBuilder(msg);
        StackTraceElement[] stack = e.getStackTrace();
        // 只取前10行
        int n = Math.min(stack.length, 10);
        for (int i = 0; i < n; i++) sb.append("\n  at ").append(stack[i]);
        return sb.toString();
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}
