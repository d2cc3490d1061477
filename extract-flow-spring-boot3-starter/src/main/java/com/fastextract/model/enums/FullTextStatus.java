package com.fastextract.model.enums;

/**
 * 全文获取状态
 */
public enum FullTextStatus {
    NOT_FETCHED,
    FETCHING,
    SUCCESS,
    FAILED
}
