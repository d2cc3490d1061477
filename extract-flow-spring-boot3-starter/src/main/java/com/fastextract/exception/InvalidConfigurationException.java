package com.fastextract.exception;

/**
 * 配置错误, 构造时立即失败
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
