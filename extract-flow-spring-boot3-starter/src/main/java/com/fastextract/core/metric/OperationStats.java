package com.fastextract.core.metric;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 单个操作的统计快照
 */
@Getter
@Builder
@ToString
public class OperationStats {

    private final String name;
    private final long count;
    private final long successCount;
    private final long failureCount;
    private final long totalMs;
    private final long minMs;
    private final long maxMs;
    private final double averageMs;
    /** 首次记录开始到最近一次记录结束之间的吞吐 */
    private final double throughputPerSecond;
}
