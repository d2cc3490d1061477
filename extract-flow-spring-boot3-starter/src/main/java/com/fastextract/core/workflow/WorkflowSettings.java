package com.fastextract.core.workflow;

import com.fastextract.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 来源数量策略与内容门槛
 */
@Getter
@ToString
public final class WorkflowSettings {

    private final int minContentLength;
    private final int sourceSoftLimit;
    private final int sourceHardLimit;
    /** 耗时估算: 每批来源数 */
    private final int estimateBatchSize;
    /** 耗时估算: 每批秒数 */
    private final int estimateSecondsPerBatch;

    @Builder
    private WorkflowSettings(Integer minContentLength, Integer sourceSoftLimit, Integer sourceHardLimit,
                             Integer estimateBatchSize, Integer estimateSecondsPerBatch) {
        this.minContentLength = minContentLength == null ? 50 : minContentLength;
        this.sourceSoftLimit = sourceSoftLimit == null ? 300 : sourceSoftLimit;
        this.sourceHardLimit = sourceHardLimit == null ? 500 : sourceHardLimit;
        this.estimateBatchSize = estimateBatchSize == null ? 5 : estimateBatchSize;
        this.estimateSecondsPerBatch = estimateSecondsPerBatch == null ? 6 : estimateSecondsPerBatch;
        if (this.minContentLength < 0) {
            throw new InvalidConfigurationException("minContentLength must be >= 0");
        }
        if (this.sourceSoftLimit <= 0 || this.sourceHardLimit < this.sourceSoftLimit) {
            throw new InvalidConfigurationException("source limits must satisfy 0 < soft <= hard, got soft="
                    + this.sourceSoftLimit + " hard=" + this.sourceHardLimit);
        }
        if (this.estimateBatchSize <= 0 || this.estimateSecondsPerBatch <= 0) {
            throw new InvalidConfigurationException("estimate batch size and seconds per batch must be > 0");
        }
    }

    public static WorkflowSettings defaults() {
        return WorkflowSettings.builder().build();
    }
}
