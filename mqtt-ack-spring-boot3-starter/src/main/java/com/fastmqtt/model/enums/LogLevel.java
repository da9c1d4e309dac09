package com.fastmqtt.model.enums;

import java.util.Locale;

/**
 * 单次调用的日志级别
 * INFO: 无论成败都输出一条记录; ERROR: 仅失败时输出
 */
public enum LogLevel {
    INFO, ERROR;

    public static LogLevel from(String v) {
        return LogLevel.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }

    public boolean logSuccess() {
        return this == INFO;
    }
}
