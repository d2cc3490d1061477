package com.fastextract.exception;

import com.fastextract.core.extract.ExtractionBatchResult;

import java.util.Map;

/**
 * 批量抽取超时
 * 在所有在途任务结束后才抛出, 附带超时前已完成的部分结果
 */
public class ExtractionTimeoutException extends ExtractFlowException {

    private final transient ExtractionBatchResult partialResult;

    public ExtractionTimeoutException(String message, Map<String, Object> context,
                                      ExtractionBatchResult partialResult) {
        super(message, context);
        this.partialResult = partialResult;
    }

    public long getTimeoutMs() {
        Object v = getContext().get("timeoutMs");
        return v instanceof Number n ? n.longValue() : -1L;
    }

    public int getCompletedBeforeTimeout() {
        return contextInt("completedBeforeTimeout");
    }

    public ExtractionBatchResult getPartialResult() {
        return partialResult;
    }
}
