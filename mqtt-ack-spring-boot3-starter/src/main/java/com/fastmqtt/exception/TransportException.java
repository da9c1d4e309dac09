package com.fastmqtt.exception;

/**
 * 发布/订阅/ACK 被 broker 或客户端拒绝, 属于系统错误, 配置了本地重试时可重试
 */
public class TransportException extends MqttAckException {

    public TransportException(String message) { super(message); }

    public TransportException(String message, Throwable cause) { super(message, cause); }
}
