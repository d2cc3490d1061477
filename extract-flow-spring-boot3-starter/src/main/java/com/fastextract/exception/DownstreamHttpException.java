package com.fastextract.exception;

import com.fastextract.core.spi.HasStatusCode;

/**
 * 协作方可直接抛出的 HTTP 异常, 分类器会读取状态码
 */
public class DownstreamHttpException extends RuntimeException implements HasStatusCode {

    private final int statusCode;

    public DownstreamHttpException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public DownstreamHttpException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    @Override
    public int statusCode() {
        return statusCode;
    }
}
