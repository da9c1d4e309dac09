package com.fastmqtt.exception;

/**
 * 业务错误（非系统错误）
 * 重试立即终止; 订阅侧视为已处理, 消息照常 ACK, 仅在日志 ignore_err 字段留痕
 */
public class BusinessException extends MqttAckException {

    /** 业务错误码 */
    private final String code;

    public BusinessException(String code, String message) {
        super(message);
        this.code = code;
    }

    public BusinessException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "BusinessException[" + code + "]: " + getMessage();
    }
}
