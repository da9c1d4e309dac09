package com.fastmqtt.core;

import com.fastmqtt.core.dispatch.DispatchEngine;
import com.fastmqtt.core.metric.MqttAckMetrics;
import com.fastmqtt.core.publish.PublishExecutor;
import com.fastmqtt.core.retry.LocalRetry;
import com.fastmqtt.core.retry.LocalRetryRunner;
import com.fastmqtt.core.spi.ErrorClassifier;
import com.fastmqtt.core.spi.InboundMessage;
import com.fastmqtt.core.spi.MessageCodec;
import com.fastmqtt.core.spi.MessageHandler;
import com.fastmqtt.core.spi.MqttTransport;
import com.fastmqtt.core.spi.TransportCallback;
import com.fastmqtt.model.PublishOptions;
import com.fastmqtt.model.SubscribeOptions;
import com.fastmqtt.model.enums.LogLevel;
import com.fastmqtt.model.enums.Qos;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 可靠 MQTT 客户端
 * 构造即校验配置并连接; publish 同步执行, 订阅消息交给 DispatchEngine 并发处理
 */
public class MqttAckClient {

    private static final Logger log = LoggerFactory.getLogger(MqttAckClient.class);

    /** 兜底订阅: QoS1 + INFO + 客户端订阅日志 */
    private static final SubscribeOptions DEFAULT_ROUTE_OPTIONS = SubscribeOptions.builder()
            .qos(Qos.AT_LEAST_ONCE)
            .logLevel(LogLevel.INFO)
            .build();

    private final MqttAckClientConfig config;

    private final MqttTransport transport;

    private final PublishExecutor publishExecutor;

    private final DispatchEngine dispatchEngine;

    /** localRetry(attempts) 使用的退避参数 */
    private final Duration retryBase;

    private final Duration retryMaxDelay;

    private final AtomicBoolean disconnected = new AtomicBoolean(false);

    /**
     * @throws com.fastmqtt.exception.MqttConfigurationException 缺少必填配置, 不会发起连接
     * @throws com.fastmqtt.exception.MqttConnectionException    连接失败
     */
    public MqttAckClient(MqttAckClientConfig config, MqttTransport transport, MessageCodec codec,
                         ErrorClassifier classifier, ExecutorService dispatchExecutor,
                         MqttAckMetrics meter, Duration retryBase, Duration retryMaxDelay) {
        Objects.requireNonNull(config, "config").validate();
        this.config = config;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.retryBase = retryBase == null ? LocalRetry.DEFAULT_BASE : retryBase;
        this.retryMaxDelay = retryMaxDelay == null ? LocalRetry.DEFAULT_MAX_DELAY : retryMaxDelay;

        LocalRetryRunner retryRunner = new LocalRetryRunner(classifier);
        this.publishExecutor = new PublishExecutor(transport, codec, retryRunner, config.getPubLogger(), meter);
        this.dispatchEngine = new DispatchEngine(dispatchExecutor, retryRunner, classifier, meter);

        transport.connect(config, new ClientCallback());
    }

    public void publish(String topic, Object value) {
        publish(topic, value, PublishOptions.defaults());
    }

    /**
     * @throws com.fastmqtt.exception.PayloadEncodingException 编码失败
     * @throws com.fastmqtt.exception.TransportException       最后一次发送仍失败
     */
    public void publish(String topic, Object value, PublishOptions options) {
        publishExecutor.publish(topic, value, options);
    }

    public void subscribe(String topic, MessageHandler handler) {
        subscribe(topic, handler, SubscribeOptions.defaults());
    }

    /**
     * 订阅, 阻塞到 broker 确认
     * @throws com.fastmqtt.exception.TransportException 订阅被拒绝
     */
    public void subscribe(String topic, MessageHandler handler, SubscribeOptions options) {
        Objects.requireNonNull(handler, "handler");
        // 拷贝一份, 订阅后调用方再修改 options 不影响已生效的订阅
        SubscribeOptions opt = options == null ? SubscribeOptions.defaults() : options.toBuilder().build();
        transport.subscribe(topic, opt.getQos().code, m -> {
            traceArrival(m);
            dispatchEngine.dispatch(m, handler, opt, config.getSubLogger());
        });
        log.info("[Mqtt-Client] subscribed, topic={}, qos={}", topic, opt.getQos().code);
    }

    /**
     * 断开连接, 只生效一次; 不中断正在处理的消息
     */
    public void disconnect() {
        if (!disconnected.compareAndSet(false, true)) {
            return;
        }
        transport.disconnect(config.getDisconnectGrace());
        log.info("[Mqtt-Client] disconnected, clientId={}", config.getClientId());
    }

    /**
     * 按客户端配置的 base/maxDelay 构造本地重试
     */
    public LocalRetry localRetry(int attempts) {
        return LocalRetry.of(retryBase, retryMaxDelay, attempts);
    }

    public boolean isConnected() {
        return transport.isConnected();
    }

    public MqttAckClientConfig getConfig() {
        return config;
    }

    private void traceArrival(InboundMessage m) {
        if (!config.isDebug()) {
            return;
        }
        Logger l = config.getClientLogger() != null ? config.getClientLogger() : log;
        l.info("[Mqtt-Client] arrived topic={}, id={}, qos={}, bytes={}", m.topic(), m.id(), m.qos(), m.payload().length);
    }

    private class ClientCallback implements TransportCallback {

        @Override
        public void onConnectionAttempt(String serverUri) {
            Logger l = config.getClientLogger();
            if (l != null) {
                l.atInfo().addKeyValue("serverUri", serverUri).log("ConnectionAttempt");
            }
        }

        @Override
        public void onConnect(boolean reconnect, String serverUri) {
            Logger l = config.getClientLogger();
            if (l != null) {
                l.atInfo().addKeyValue("serverUri", serverUri).log(reconnect ? "Reconnecting" : "OnConnect");
            }
        }

        @Override
        public void onConnectionLost(Throwable cause) {
            Logger l = config.getClientLogger();
            if (l != null) {
                l.atError().addKeyValue("error", String.valueOf(cause)).log("ConnectionLost");
            }
        }

        @Override
        public void onUnroutedMessage(InboundMessage message) {
            traceArrival(message);
            dispatchEngine.dispatch(message, config.getDefaultHandler(), DEFAULT_ROUTE_OPTIONS, config.getSubLogger());
        }
    }
}
