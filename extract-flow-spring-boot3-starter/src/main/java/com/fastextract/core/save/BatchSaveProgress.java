package com.fastextract.core.save;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 每个批次结束后回调一次
 */
@Getter
@ToString
@AllArgsConstructor
public final class BatchSaveProgress {

    private final int batchNumber;
    private final int totalBatches;
    private final int processedCount;
    private final int savedCount;
    private final int failedCount;
    private final int totalItems;
}
