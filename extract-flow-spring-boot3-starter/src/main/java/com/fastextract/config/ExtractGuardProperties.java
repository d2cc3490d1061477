package com.fastextract.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * extract:
 *   guard:
 *     rate-limiter:
 *       enabled: true
 *       limit-for-period: 5
 *       limit-refresh-period: 1s
 *       timeout-duration: 2s
 *     bulkhead:
 *       enabled: true
 *       max-concurrent-calls: 10
 *       max-wait-duration: 0ms
 *     rl-per-dependency:
 *       persistence: { enabled: true, limit-for-period: 1, limit-refresh-period: 700ms }
 */
@Data
@ConfigurationProperties(prefix = "extract.guard")
public class ExtractGuardProperties {

    /** 默认配置（可被依赖名覆盖） */
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按依赖名覆盖: persistence / enrichment */
    private Map<String, BhConfig> bhPerDependency;
    private Map<String, RlConfig> rlPerDependency;

    @Data
    public static class BhConfig {
        private boolean enabled = false;
        private int maxConcurrentCalls = 10;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 5;
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofSeconds(2);
    }
}
