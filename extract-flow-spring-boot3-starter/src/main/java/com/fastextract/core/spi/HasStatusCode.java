package com.fastextract.core.spi;

/**
 * 携带 HTTP 状态码的异常实现此接口, 供错误分类使用
 */
public interface HasStatusCode {

    int statusCode();
}
