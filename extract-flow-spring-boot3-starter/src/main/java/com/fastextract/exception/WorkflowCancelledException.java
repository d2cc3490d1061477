package com.fastextract.exception;

import java.util.Map;

/**
 * 调用方取消
 */
public class WorkflowCancelledException extends ExtractFlowException {

    public WorkflowCancelledException(String message, Map<String, Object> context) {
        super(message, context);
    }
}
