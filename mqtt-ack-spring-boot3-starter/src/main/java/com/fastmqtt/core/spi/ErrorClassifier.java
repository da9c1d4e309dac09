package com.fastmqtt.core.spi;

/**
 * 错误分级: 业务错误（可忽略） / 系统错误（需上抛）
 * 发布重试与订阅派发共用
 */
public interface ErrorClassifier {

    /**
     * @param t 执行抛出的异常
     * @return true=业务错误, 重试立即终止, 订阅侧照常 ACK; false=系统错误
     */
    boolean isIgnorable(Throwable t);

    /** 重试条件: 有错误且不是业务错误 */
    default boolean shouldRetry(Throwable t) {
        return t != null && !isIgnorable(t);
    }
}
