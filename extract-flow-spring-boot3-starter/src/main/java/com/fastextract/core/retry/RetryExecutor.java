package com.fastextract.core.retry;

import com.fastextract.core.failure.NormalizedError;
import com.fastextract.core.metric.ExtractMetrics;
import com.fastextract.core.spi.BackoffPolicy;
import com.fastextract.core.timer.TaskTimer;
import com.fastextract.core.timer.WheelTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 异步重试执行器
 * 第 1 次尝试立即执行; 失败后按策略判断是否重试, 等待挂在时间轮上, 不阻塞线程
 * 用尽次数后原样抛出最后一次的异常, 不额外包装
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final TaskTimer timer;

    private final BackoffPolicy backoff;

    private final ExtractMetrics metrics;

    public RetryExecutor(TaskTimer timer, BackoffPolicy backoff, ExtractMetrics metrics) {
        this.timer = timer;
        this.backoff = backoff;
        this.metrics = metrics;
    }

    public <T> CompletableFuture<T> executeWithRetry(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, policy, 1, result);
        return result;
    }

    private <T> void attempt(Supplier<CompletableFuture<T>> operation, RetryPolicy policy,
                             int attempt, CompletableFuture<T> result) {
        CompletableFuture<T> call;
        try {
            call = operation.get();
            if (call == null) {
                call = CompletableFuture.failedFuture(new IllegalStateException("operation returned null future"));
            }
        } catch (RuntimeException e) {
            // 同步抛出同样算一次失败
            call = CompletableFuture.failedFuture(e);
        }

        call.whenComplete((value, err) -> {
            if (err == null) {
                result.complete(value);
                return;
            }
            Throwable cause = NormalizedError.unwrap(err);
            if (attempt >= policy.getMaxAttempts() || !shouldRetry(policy, cause)) {
                if (attempt > 1) {
                    log.debug("[Retry] giving up after attempt {}/{}: {}", attempt, policy.getMaxAttempts(), cause.toString());
                }
                result.completeExceptionally(cause);
                return;
            }

            long delay = backoff.delayMillis(attempt, policy);
            fireOnRetry(policy, attempt, cause, delay);
            metrics.incRetry();
            log.debug("[Retry] attempt {}/{} failed, retry in {} ms: {}",
                    attempt, policy.getMaxAttempts(), delay, cause.toString());

            CompletableFuture<Void> pause;
            try {
                pause = timer.delay(WheelTask.Kind.RETRY_BACKOFF, delay);
            } catch (RuntimeException e) {
                // 回调内抛出会让 result 永远不完成
                pause = CompletableFuture.failedFuture(e);
            }
            pause.whenComplete((ignored, timerErr) -> {
                if (timerErr != null) {
                    // 定时器停止, 不再重试
                    timerErr.addSuppressed(cause);
                    result.completeExceptionally(timerErr);
                    return;
                }
                attempt(operation, policy, attempt + 1, result);
            });
        });
    }

    private static boolean shouldRetry(RetryPolicy policy, Throwable cause) {
        try {
            return policy.getShouldRetry().test(cause);
        } catch (RuntimeException e) {
            log.warn("[Retry] shouldRetry predicate threw, treat as non-retryable: {}", e.toString());
            return false;
        }
    }

    private static void fireOnRetry(RetryPolicy policy, int attempt, Throwable cause, long delay) {
        try {
            policy.getOnRetry().onRetry(attempt, cause, delay);
        } catch (RuntimeException e) {
            log.warn("[Retry] onRetry listener threw, ignored: {}", e.toString());
        }
    }
}
