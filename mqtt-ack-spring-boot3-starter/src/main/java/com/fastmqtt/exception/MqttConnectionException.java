package com.fastmqtt.exception;

/**
 * 首次连接失败, 直接抛给调用方, 本地不重试
 */
public class MqttConnectionException extends MqttAckException {

    public MqttConnectionException(String addr, Throwable cause) {
        super("mqtt connect failed, addr=" + addr, cause);
    }
}
