package com.fastextract.exception;

import java.util.Map;

/**
 * 输入校验失败, 不可重试
 */
public class ExtractionValidationException extends ExtractFlowException {

    public ExtractionValidationException(String message, Map<String, Object> context) {
        super(message, context);
    }
}
