package com.fastmqtt.core.spi;

import com.fastmqtt.core.MqttAckClientConfig;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * 底层 MQTT 客户端
 * 必须关闭自动 ACK, 且不要求按序逐条回调
 * publish/ack 需支持多线程并发调用
 */
public interface MqttTransport {

    /**
     * 建立连接
     * @throws com.fastmqtt.exception.MqttConnectionException 首次连接失败
     */
    void connect(MqttAckClientConfig config, TransportCallback callback);

    /**
     * 发布并阻塞等待发送确认
     * @throws com.fastmqtt.exception.TransportException 发送失败
     */
    void publish(String topic, int qos, boolean retained, byte[] payload);

    /**
     * 订阅并阻塞等待 SUBACK; 回调在传输层线程执行, 调用方不得阻塞
     * @throws com.fastmqtt.exception.TransportException 订阅被拒绝
     */
    void subscribe(String topicFilter, int qos, Consumer<InboundMessage> callback);

    /** 优雅断开, 超过 grace 后强制关闭 */
    void disconnect(Duration grace);

    boolean isConnected();
}
