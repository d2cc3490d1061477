package com.fastextract.core.metric;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
@ToString
public class PerformanceReport {

    public static final String RATING_GOOD = "good";
    public static final String RATING_NEEDS_IMPROVEMENT = "needs-improvement";
    public static final String RATING_POOR = "poor";

    private final Instant generatedAt;

    /** 按操作名排序 */
    private final List<OperationStats> operations;

    private final long memoryHighWaterBytes;

    private final String overallRating;
}
