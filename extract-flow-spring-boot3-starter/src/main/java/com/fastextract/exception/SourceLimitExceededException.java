package com.fastextract.exception;

import java.util.Map;

/**
 * 来源数量超过硬上限
 */
public class SourceLimitExceededException extends ExtractFlowException {

    public SourceLimitExceededException(String message, int sourceCount, int hardLimit) {
        super(message, Map.of("sourceCount", sourceCount, "hardLimit", hardLimit));
    }
}
