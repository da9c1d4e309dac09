package com.fastmqtt.exception;

/**
 * 所有对外异常的基类（非受检）
 */
public class MqttAckException extends RuntimeException {

    public MqttAckException(String message) { super(message); }

    public MqttAckException(String message, Throwable cause) { super(message, cause); }
}
