package com.fastextract.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 批次级异常基类
 * 携带结构化上下文（已完成数量、阈值等），便于调用方输出部分进度信息
 */
public class ExtractFlowException extends RuntimeException {

    private final Map<String, Object> context;

    public ExtractFlowException(String message, Map<String, Object> context) {
        this(message, context, null);
    }

    public ExtractFlowException(String message, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /** 读取整型上下文字段, 不存在返回 -1 */
    public int contextInt(String key) {
        Object v = context.get(key);
        return v instanceof Number n ? n.intValue() : -1;
    }
}
