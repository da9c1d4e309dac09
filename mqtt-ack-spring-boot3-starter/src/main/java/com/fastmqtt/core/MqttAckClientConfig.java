package com.fastmqtt.core;

import com.fastmqtt.core.spi.MessageHandler;
import com.fastmqtt.exception.MqttConfigurationException;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;

import java.time.Duration;

/**
 * 客户端配置
 * userName/password/clientId/defaultHandler/pubLogger/subLogger/addr 必填
 * clientLogger 可空, 为空时不输出连接生命周期日志
 */
@Getter
@Builder
public class MqttAckClientConfig {

    /** broker 地址, host:port 或完整 uri */
    private final String addr;

    private final String userName;

    private final String password;

    private final String clientId;

    private final boolean cleanSession;

    /** 输出原始到达消息 */
    private final boolean debug;

    @Builder.Default
    private final boolean automaticReconnect = true;

    @Builder.Default
    private final Duration connectionTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration keepAlive = Duration.ofSeconds(60);

    /** 断开时等待在途报文的时长 */
    @Builder.Default
    private final Duration disconnectGrace = Duration.ofMillis(250);

    /** 未命中任何订阅的消息由它处理 */
    private final MessageHandler defaultHandler;

    private final Logger clientLogger;

    private final Logger pubLogger;

    private final Logger subLogger;

    /**
     * 校验必填项, 不会发起连接
     * @throws MqttConfigurationException 缺少必填项
     */
    public void validate() {
        if (isBlank(userName)) {
            throw new MqttConfigurationException("UserName must be set");
        }
        if (isBlank(password)) {
            throw new MqttConfigurationException("Password must be set");
        }
        if (isBlank(clientId)) {
            throw new MqttConfigurationException("ClientId must be set");
        }
        if (defaultHandler == null) {
            throw new MqttConfigurationException("DefaultHandler must be set");
        }
        if (pubLogger == null) {
            throw new MqttConfigurationException("PubLogger must be set");
        }
        if (subLogger == null) {
            throw new MqttConfigurationException("SubLogger must be set");
        }
        if (isBlank(addr)) {
            throw new MqttConfigurationException("Addr must be set");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        return "MqttAckClientConfig{addr=" + addr + ", userName=" + userName + ", clientId=" + clientId
                + ", cleanSession=" + cleanSession + ", debug=" + debug + ", automaticReconnect=" + automaticReconnect
                + ", connectionTimeout=" + connectionTimeout + ", keepAlive=" + keepAlive
                + ", disconnectGrace=" + disconnectGrace + "}";
    }
}
