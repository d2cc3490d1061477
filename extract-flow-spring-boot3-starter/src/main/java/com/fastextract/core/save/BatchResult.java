package com.fastextract.core.save;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * 批量保存结果, 返回后不可变
 */
@Getter
@Builder
@ToString
public final class BatchResult {

    private final int totalCount;
    private final int savedCount;
    /** 重复 id 被跳过的数量 */
    private final int skippedCount;
    private final int failedCount;
    private final List<FailedItem> failedItems;
    /** originalId -> persistedId, 仅包含保存成功的条目 */
    private final Map<String, String> idMapping;

    public static BatchResult empty() {
        return BatchResult.builder()
                .failedItems(List.of())
                .idMapping(Map.of())
                .build();
    }
}
