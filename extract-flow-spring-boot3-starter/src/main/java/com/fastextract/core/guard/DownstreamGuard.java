package com.fastextract.core.guard;

import com.fastextract.config.ExtractGuardProperties;
import com.fastextract.core.failure.NormalizedError;
import com.fastextract.exception.guard.DownstreamBulkheadFullException;
import com.fastextract.exception.guard.DownstreamRateLimitedException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 下游调用的限流/隔离装饰, 按依赖名（persistence / enrichment）配置, 默认都关闭
 * 拒绝转换为 DownstreamRateLimitedException / DownstreamBulkheadFullException, 交给分类器判定重试
 */
public class DownstreamGuard {

    public static final String PERSISTENCE = "persistence";
    public static final String ENRICHMENT = "enrichment";

    private final ExtractGuardProperties props;

    private final ConcurrentHashMap<String, Bulkhead>    bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter> rlCache = new ConcurrentHashMap<>();

    public DownstreamGuard(ExtractGuardProperties props) {
        this.props = props;
    }

    /** 全部关闭的实例 */
    public static DownstreamGuard passThrough() {
        return new DownstreamGuard(new ExtractGuardProperties());
    }

    /**
     * 组合装饰 RateLimiter -> Bulkhead 后执行
     * 注意: 限流等待 timeoutDuration 期间会占用调用线程
     */
    public <T> CompletableFuture<T> execute(String dependency, Supplier<CompletableFuture<T>> call) {
        Supplier<CompletionStage<T>> decorated = call::get;

        // Bulkhead 限制下游并发
        ExtractGuardProperties.BhConfig bh = resolve(props.getBulkhead(), props.getBhPerDependency(), dependency);
        if (bh != null && bh.isEnabled()) {
            Bulkhead b = bhCache.computeIfAbsent(dependency, k -> buildBh(k, bh));
            decorated = Bulkhead.decorateCompletionStage(b, decorated);
        }

        // RateLimit 最外层, 抑制突发流量
        ExtractGuardProperties.RlConfig rl = resolve(props.getRateLimiter(), props.getRlPerDependency(), dependency);
        if (rl != null && rl.isEnabled()) {
            RateLimiter r = rlCache.computeIfAbsent(dependency, k -> buildRl(k, rl));
            decorated = RateLimiter.decorateCompletionStage(r, decorated);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        CompletionStage<T> stage;
        try {
            stage = decorated.get();
        } catch (RuntimeException e) {
            result.completeExceptionally(translate(e));
            return result;
        }
        stage.whenComplete((v, err) -> {
            if (err == null) {
                result.complete(v);
            } else {
                result.completeExceptionally(translate(NormalizedError.unwrap(err)));
            }
        });
        return result;
    }

    private static Throwable translate(Throwable t) {
        if (t instanceof RequestNotPermitted) {
            return new DownstreamRateLimitedException(t);
        }
        if (t instanceof BulkheadFullException) {
            return new DownstreamBulkheadFullException(t);
        }
        return t;
    }

    private static <C> C resolve(C defaults, Map<String, C> overrides, String dependency) {
        if (overrides != null && overrides.get(dependency) != null) {
            return overrides.get(dependency);
        }
        return defaults;
    }

    private static RateLimiter buildRl(String dependency, ExtractGuardProperties.RlConfig r) {
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + dependency, cfg);
    }

    private static Bulkhead buildBh(String dependency, ExtractGuardProperties.BhConfig b) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + dependency, cfg);
    }
}
