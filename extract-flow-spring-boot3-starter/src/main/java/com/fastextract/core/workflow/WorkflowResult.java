package com.fastextract.core.workflow;

import com.fastextract.core.extract.ExtractionBatchResult;
import com.fastextract.core.save.BatchResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 工作流最终结果
 */
@Getter
@Builder
@ToString(exclude = "payload")
public class WorkflowResult {

    /** 下游抽取返回的原始内容 */
    private final JsonNode payload;
    private final BatchResult saveResult;
    /** 抓取超时降级时为超时前的部分结果 */
    private final ExtractionBatchResult fetchResult;
    private final boolean fetchTimedOut;
    private final PreparationResult preparation;
    /** 来源数量超过软上限时的提示 */
    private final String warning;
}
