package com.fastmqtt.core.publish;

import com.fastmqtt.core.metric.MqttAckMetrics;
import com.fastmqtt.core.retry.LocalRetryRunner;
import com.fastmqtt.core.spi.MessageCodec;
import com.fastmqtt.core.spi.MqttTransport;
import com.fastmqtt.exception.TransportException;
import com.fastmqtt.model.PublishOptions;
import org.slf4j.Logger;
import org.slf4j.spi.LoggingEventBuilder;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 发布执行器
 * 编码 -> (本地重试)发布 -> 记录一条带耗时的日志; 最终错误抛给调用方
 */
public class PublishExecutor {

    private final MqttTransport transport;

    private final MessageCodec codec;

    private final LocalRetryRunner retryRunner;

    /** 发布日志 */
    private final Logger pubLogger;

    private final MqttAckMetrics meter;

    public PublishExecutor(MqttTransport transport, MessageCodec codec, LocalRetryRunner retryRunner,
                           Logger pubLogger, MqttAckMetrics meter) {
        this.transport = transport;
        this.codec = codec;
        this.retryRunner = retryRunner;
        this.pubLogger = Objects.requireNonNull(pubLogger, "pubLogger");
        this.meter = meter;
    }

    /**
     * 发布
     * 未配置本地重试时只发一次; 配置了则最多 attempts 次, 遇到业务错误立即停止, 只抛最后一次错误
     * @throws com.fastmqtt.exception.PayloadEncodingException 编码失败, 不会调用传输层
     * @throws TransportException 发送失败
     */
    public void publish(String topic, Object value, PublishOptions options) {
        // 快照, 重试期间调用方修改 options 不影响本次发布
        PublishOptions opt = options == null ? PublishOptions.defaults() : options.toBuilder().build();
        long startNanos = System.nanoTime();

        byte[] message = null;
        RuntimeException err = null;
        try {
            message = codec.encode(value);
            byte[] body = message;
            retryRunner.run("mqtt-pub:" + topic, opt.getLocalRetry(), () -> {
                transport.publish(topic, opt.getQos().code, opt.isRetained(), body);
                return null;
            });
        } catch (RuntimeException e) {
            err = e;
        } catch (Exception e) {
            err = new TransportException("publish failed, topic=" + topic, e);
        }

        long latencyMs = (System.nanoTime() - startNanos) / 1_000_000;
        if (meter != null) {
            meter.recordPublishMillis(latencyMs);
            if (err == null) {
                meter.incPublishSuccess();
            } else {
                meter.incPublishFailed();
            }
        }
        log(topic, opt, message, latencyMs, err);
        if (err != null) {
            throw err;
        }
    }

    private void log(String topic, PublishOptions opt, byte[] message, long latencyMs, Throwable err) {
        if (err == null && !opt.getLogLevel().logSuccess()) {
            return;
        }
        LoggingEventBuilder event = err == null ? pubLogger.atInfo() : pubLogger.atError();
        event.addKeyValue("topic", topic)
                .addKeyValue("qos", opt.getQos().code)
                .addKeyValue("latency", latencyMs)
                .addKeyValue("error", err == null ? null : err.toString())
                .log(message == null ? "" : new String(message, StandardCharsets.UTF_8));
    }
}
