package com.fastextract.core.failure;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 分类结果, 不可变
 */
@Getter
@Builder
@ToString(exclude = "originalError")
public final class ErrorClassification {

    private final ErrorCategory category;

    private final boolean retryable;

    /** 面向用户, 不含原始错误文本 */
    private final String userMessage;

    private final String suggestedAction;

    /** 可为 null */
    private final Long retryDelayMs;

    private final Throwable originalError;

    public static ErrorClassification of(ErrorCategory category, Throwable originalError) {
        return ErrorClassification.builder()
                .category(category)
                .retryable(category.isRetryable())
                .userMessage(category.getUserMessage())
                .suggestedAction(category.getSuggestedAction())
                .retryDelayMs(category.getRetryDelayMs())
                .originalError(originalError)
                .build();
    }
}
