package com.fastmqtt.exception;

/**
 * 必填配置缺失, 启动即失败, 不可重试
 */
public class MqttConfigurationException extends MqttAckException {

    public MqttConfigurationException(String message) { super(message); }
}
