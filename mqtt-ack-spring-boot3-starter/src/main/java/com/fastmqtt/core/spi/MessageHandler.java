package com.fastmqtt.core.spi;

/**
 * 订阅消息处理器
 * 正常返回=处理成功（消息 ACK）; 抛 BusinessException=业务失败（同样 ACK）; 其他异常=系统错误（不 ACK, 等待重投）
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(String topic, byte[] payload) throws Exception;
}
