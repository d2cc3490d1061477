package com.fastextract.core.extract;

import com.fastextract.model.LiteratureRecord;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 批量抽取结果, successCount + failedCount == totalCount
 */
@Getter
@Builder
@ToString(exclude = {"updatedRecords", "outcomes"})
public final class ExtractionBatchResult {

    private final int totalCount;
    private final int successCount;
    private final int failedCount;
    private final List<LiteratureRecord> updatedRecords;
    /** 失败条目的原始 id */
    private final List<String> failedIds;
    /** 按输入顺序 */
    private final List<ExtractionOutcome> outcomes;

    public static ExtractionBatchResult empty() {
        return ExtractionBatchResult.builder()
                .updatedRecords(List.of())
                .failedIds(List.of())
                .outcomes(List.of())
                .build();
    }
}
