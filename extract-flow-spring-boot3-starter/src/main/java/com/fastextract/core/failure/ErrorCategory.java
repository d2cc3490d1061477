package com.fastextract.core.failure;

/**
 * 错误类别
 * 每个类别的可重试性、建议延迟以及面向用户的文案固定
 */
public enum ErrorCategory {

    CANCELLATION(false, null,
            "The operation was cancelled.",
            "No action needed."),

    AUTHENTICATION(false, null,
            "Your session is not authorized for this operation.",
            "Please sign in again and retry."),

    RATE_LIMIT(true, 30_000L,
            "The service is receiving too many requests.",
            "Wait about 30 seconds before trying again."),

    NOT_FOUND(false, null,
            "The requested item could not be found.",
            "Check that the item still exists."),

    TIMEOUT(true, 2_000L,
            "The request took too long to complete.",
            "Try again in a moment."),

    TRANSIENT(true, 1_000L,
            "A network problem interrupted the request.",
            "Check your connection and try again."),

    SERVER_ERROR(true, 5_000L,
            "The service is temporarily unavailable.",
            "Try again in a few seconds."),

    VALIDATION(false, null,
            "Some of the submitted data is invalid.",
            "Review the input and correct any missing fields."),

    CLIENT_ERROR(false, null,
            "The request could not be processed.",
            "Review the request and try again."),

    UNKNOWN(true, 1_000L,
            "An unexpected error occurred.",
            "Try again; contact support if the problem persists.");

    private final boolean retryable;

    /** 建议延迟, 不可重试时为 null */
    private final Long retryDelayMs;

    private final String userMessage;

    private final String suggestedAction;

    ErrorCategory(boolean retryable, Long retryDelayMs, String userMessage, String suggestedAction) {
        this.retryable = retryable;
        this.retryDelayMs = retryDelayMs;
        this.userMessage = userMessage;
        this.suggestedAction = suggestedAction;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Long getRetryDelayMs() {
        return retryDelayMs;
    }

    public String getUserMessage() {
        return userMessage;
    }

    public String getSuggestedAction() {
        return suggestedAction;
    }
}
