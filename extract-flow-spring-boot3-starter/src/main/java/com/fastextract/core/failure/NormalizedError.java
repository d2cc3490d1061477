package com.fastextract.core.failure;

import com.fastextract.core.spi.HasStatusCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

/**
 * 归一化后的错误: 消息 + 可选状态码 + 类型
 * 分类规则只面向此结构, 不直接处理异步包装异常
 */
public final class NormalizedError {

    private final String message;

    private final String lowerMessage;

    /** 可为 null */
    private final Integer statusCode;

    private final Class<? extends Throwable> type;

    /** 去掉包装层后的 cause 链 */
    private final List<Throwable> chain;

    private NormalizedError(String message, Integer statusCode,
                            Class<? extends Throwable> type, List<Throwable> chain) {
        this.message = message;
        this.lowerMessage = message.toLowerCase(Locale.ROOT);
        this.statusCode = statusCode;
        this.type = type;
        this.chain = chain;
    }

    public static NormalizedError from(Throwable error) {
        Throwable root = unwrap(error);
        if (root == null) {
            return new NormalizedError("", null, Throwable.class, List.of());
        }
        List<Throwable> chain = new ArrayList<>();
        Integer status = null;
        // 防止循环引用
        for (Throwable t = root; t != null && chain.size() < 16; t = t.getCause()) {
            if (chain.contains(t)) {
                break;
            }
            chain.add(t);
            if (status == null && t instanceof HasStatusCode hs) {
                status = hs.statusCode();
            }
        }
        String msg = root.getMessage() == null ? "" : root.getMessage();
        return new NormalizedError(msg, status, root.getClass(), Collections.unmodifiableList(chain));
    }

    /**
     * 剥掉 CompletionException / ExecutionException 包装
     */
    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException)
                && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    public String getMessage() {
        return message;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public Class<? extends Throwable> getType() {
        return type;
    }

    public boolean hasStatus(int... codes) {
        if (statusCode == null) {
            return false;
        }
        for (int c : codes) {
            if (statusCode == c) {
                return true;
            }
        }
        return false;
    }

    public boolean statusBetween(int fromInclusive, int toInclusive) {
        return statusCode != null && statusCode >= fromInclusive && statusCode <= toInclusive;
    }

    /** cause 链中是否有该类型 */
    public boolean causedBy(Class<? extends Throwable> cls) {
        for (Throwable t : chain) {
            if (cls.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    /** 忽略大小写的任一关键词匹配 */
    public boolean messageContainsAny(String... keywords) {
        for (String k : keywords) {
            if (lowerMessage.contains(k)) {
                return true;
            }
        }
        return false;
    }

    public boolean messageMatches(Pattern pattern) {
        return pattern.matcher(message).find();
    }

    @Override
    public String toString() {
        return "NormalizedError{type=" + type.getSimpleName() + ", status=" + statusCode + ", message='" + message + "'}";
    }
}
