package com.fastextract.core.failure;

import com.fastextract.exception.WorkflowCancelledException;
import com.fastextract.exception.guard.CircuitOpenException;
import com.fastextract.exception.guard.DownstreamBulkheadFullException;
import com.fastextract.exception.guard.DownstreamRateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * 错误分类器
 * 先归一化, 再按有序规则表匹配, 首个命中生效; 无匹配归为 UNKNOWN（可重试, 1s）
 * 无状态, 线程安全
 */
public class ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    private static final Pattern AUTH_CODE = Pattern.compile("\\b40[13]\\b");
    private static final Pattern RATE_LIMIT_CODE = Pattern.compile("\\b429\\b");
    private static final Pattern NOT_FOUND_CODE = Pattern.compile("\\b404\\b");
    private static final Pattern SERVER_CODE = Pattern.compile("\\b5\\d{2}\\b");
    private static final Pattern CLIENT_CODE = Pattern.compile("\\b4\\d{2}\\b");

    /** 内置规则, 顺序即优先级 */
    private static final List<ClassificationRule> BUILT_IN = List.of(
            ClassificationRule.of("cancellation", ErrorCategory.CANCELLATION, e ->
                    e.causedBy(CancellationException.class)
                            || e.causedBy(WorkflowCancelledException.class)
                            || e.messageContainsAny("cancel", "abort")),
            ClassificationRule.of("authentication", ErrorCategory.AUTHENTICATION, e ->
                    e.hasStatus(401, 403)
                            || e.messageContainsAny("unauthorized", "forbidden", "authentication",
                            "token expired", "invalid token")
                            || e.messageMatches(AUTH_CODE)),
            ClassificationRule.of("rate-limit", ErrorCategory.RATE_LIMIT, e ->
                    e.hasStatus(429)
                            || e.causedBy(DownstreamRateLimitedException.class)
                            || e.messageContainsAny("too many requests", "rate limit")
                            || e.messageMatches(RATE_LIMIT_CODE)),
            ClassificationRule.of("not-found", ErrorCategory.NOT_FOUND, e ->
                    e.hasStatus(404)
                            || e.messageContainsAny("not found")
                            || e.messageMatches(NOT_FOUND_CODE)),
            ClassificationRule.of("timeout", ErrorCategory.TIMEOUT, e ->
                    e.hasStatus(408, 504)
                            || e.causedBy(TimeoutException.class)
                            || e.messageContainsAny("timeout", "timed out", "etimedout")),
            ClassificationRule.of("transient-network", ErrorCategory.TRANSIENT, e ->
                    e.causedBy(IOException.class)
                            || e.causedBy(DownstreamBulkheadFullException.class)
                            || e.messageContainsAny("network", "econnreset", "econnrefused", "socket hang up",
                            "connection reset", "connection refused", "fetch failed")),
            ClassificationRule.of("server-5xx", ErrorCategory.SERVER_ERROR, e ->
                    e.statusBetween(500, 599)
                            || e.causedBy(CircuitOpenException.class)
                            || e.messageContainsAny("internal server error", "service unavailable", "bad gateway")
                            || e.messageMatches(SERVER_CODE)),
            ClassificationRule.of("validation", ErrorCategory.VALIDATION, e ->
                    e.hasStatus(400, 422)
                            || e.messageContainsAny("validation", "invalid")),
            ClassificationRule.of("client-4xx", ErrorCategory.CLIENT_ERROR, e ->
                    e.statusBetween(400, 499)
                            || e.messageMatches(CLIENT_CODE))
    );

    private final List<ClassificationRule> rules;

    public ErrorClassifier() {
        this(List.of());
    }

    /**
     * @param customRules 业务规则, 先于内置规则求值
     */
    public ErrorClassifier(List<ClassificationRule> customRules) {
        List<ClassificationRule> all = new ArrayList<>();
        if (customRules != null) {
            all.addAll(customRules);
        }
        all.addAll(BUILT_IN);
        this.rules = List.copyOf(all);
    }

    public ErrorClassification classify(Throwable error) {
        NormalizedError normalized = NormalizedError.from(error);
        for (ClassificationRule rule : rules) {
            boolean hit;
            try {
                hit = rule.matches(normalized);
            } catch (RuntimeException ex) {
                // 自定义规则异常不影响后续规则
                log.warn("[Classifier] rule {} threw, skipped: {}", rule.name(), ex.toString());
                continue;
            }
            if (hit) {
                if (log.isDebugEnabled()) {
                    log.debug("[Classifier] {} matched rule={} category={}", normalized, rule.name(), rule.category());
                }
                return ErrorClassification.of(rule.category(), error);
            }
        }
        return ErrorClassification.of(ErrorCategory.UNKNOWN, error);
    }

    public boolean isRetryable(Throwable error) {
        return classify(error).isRetryable();
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }
}
