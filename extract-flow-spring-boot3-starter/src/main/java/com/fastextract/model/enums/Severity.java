package com.fastextract.model.enums;

/**
 * 通知级别
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
