package com.fastextract.core.extract;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 每条完成（成功或失败）后回调; ETA 字段仅在估算可信时非空
 */
@Getter
@ToString
@AllArgsConstructor
public final class ExtractionProgress {

    private final int completed;
    private final int total;
    private final int percentage;
    private final String estimatedTimeRemaining;
    private final Long averageTimePerItemMs;
}
