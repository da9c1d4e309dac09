package com.fastmqtt.exception;

/**
 * 消息体无法转换为字节
 */
public class PayloadEncodingException extends MqttAckException {

    public PayloadEncodingException(String message) { super(message); }

    public PayloadEncodingException(String message, Throwable cause) { super(message, cause); }
}
