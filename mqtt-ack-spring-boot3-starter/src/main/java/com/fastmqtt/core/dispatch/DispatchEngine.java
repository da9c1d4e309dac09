package com.fastmqtt.core.dispatch;

import com.fastmqtt.core.metric.MqttAckMetrics;
import com.fastmqtt.core.retry.LocalRetryRunner;
import com.fastmqtt.core.spi.ErrorClassifier;
import com.fastmqtt.core.spi.InboundMessage;
import com.fastmqtt.core.spi.MessageHandler;
import com.fastmqtt.model.SubscribeOptions;
import com.fastmqtt.model.ctx.DispatchContext;
import com.fastmqtt.model.enums.DeliveryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 订阅消息派发引擎
 * 每条投递独立提交到派发线程池, 不保证消息间顺序, 慢 handler 不阻塞其他消息
 * 仅当最终结果为成功或业务错误时 ACK; 系统错误不 ACK, 交给 broker 按 QoS 重投
 */
public class DispatchEngine {

    private static final Logger log = LoggerFactory.getLogger(DispatchEngine.class);

    /** 派发线程池 */
    private final ExecutorService dispatchExecutor;

    private final LocalRetryRunner retryRunner;

    /** 错误分级 */
    private final ErrorClassifier classifier;

    /** 指标 */
    private final MqttAckMetrics meter;

    public DispatchEngine(ExecutorService dispatchExecutor, LocalRetryRunner retryRunner,
                          ErrorClassifier classifier, MqttAckMetrics meter) {
        this.dispatchExecutor = dispatchExecutor;
        this.retryRunner = retryRunner;
        this.classifier = classifier;
        this.meter = meter;
    }

    /**
     * 在传输层回调线程上调用, 只负责提交, 立即返回
     */
    public void dispatch(InboundMessage m, MessageHandler handler, SubscribeOptions options, Logger defaultSubLogger) {
        SubscribeOptions opt = options == null ? SubscribeOptions.defaults() : options;
        Logger subLogger = opt.getSubLogger() != null ? opt.getSubLogger() : defaultSubLogger;
        try {
            dispatchExecutor.execute(() -> {
                try {
                    process(m, handler, opt, subLogger);
                } catch (Throwable ex) {
                    log.error("[Dispatch] error, topic={}, id={}", m.topic(), m.id(), ex);
                    throw ex;
                }
            });
        } catch (RejectedExecutionException e) {
            // 不在回调线程兜底执行, 消息不 ACK 等待重投
            if (meter != null) {
                meter.incRejected();
            }
            log.error("[Dispatch] rejected by executor, left unacknowledged, topic={}, id={}", m.topic(), m.id(), e);
        }
    }

    /**
     * 处理单条消息直到终态
     */
    DispatchContext process(InboundMessage m, MessageHandler handler, SubscribeOptions opt, Logger subLogger) {
        DispatchContext ctx = DispatchContext.builder()
                .topic(m.topic())
                .messageId(m.id())
                .qos(m.qos())
                .deliveredAt(m.deliveredAt() == null ? Instant.now() : m.deliveredAt())
                .build();

        ctx.setState(DeliveryState.PROCESSING);
        Throwable handlerErr = null;
        try {
            retryRunner.run("mqtt-sub:" + m.topic(), opt.getLocalRetry(), () -> {
                ctx.incAttempts();
                handler.handle(m.topic(), m.payload());
                return null;
            });
        } catch (Exception e) {
            handlerErr = e;
        } catch (Error e) {
            // Error 不重试, 按系统错误处理, 消息不 ACK
            handlerErr = e;
        }

        // 分级: 业务错误降级为成功, 原错误单独留痕
        if (handlerErr == null) {
            ctx.setState(DeliveryState.IGNORED_SUCCESS);
        } else if (classifier.isIgnorable(handlerErr)) {
            ctx.setIgnoredError(handlerErr);
            ctx.setState(DeliveryState.IGNORED_BUSINESS_ERROR);
        } else {
            ctx.setError(handlerErr);
            ctx.setState(DeliveryState.SYSTEM_ERROR);
        }

        if (ctx.getError() == null) {
            try {
                m.ack();
                ctx.setState(DeliveryState.ACKNOWLEDGED);
            } catch (RuntimeException e) {
                ctx.setError(e);
                ctx.setState(DeliveryState.DROPPED_UNACKNOWLEDGED);
            }
        } else {
            ctx.setState(DeliveryState.DROPPED_UNACKNOWLEDGED);
        }

        long latencyMs = Math.max(0, Duration.between(ctx.getDeliveredAt(), Instant.now()).toMillis());
        record(ctx, latencyMs);
        log(subLogger, opt, m, ctx, latencyMs);
        return ctx;
    }

    private void record(DispatchContext ctx, long latencyMs) {
        if (meter == null) {
            return;
        }
        meter.recordAttempts(ctx.getAttempts());
        meter.recordDispatchMillis(latencyMs);
        if (ctx.getState() == DeliveryState.ACKNOWLEDGED) {
            meter.incAcked();
            if (ctx.getIgnoredError() != null) {
                meter.incIgnored();
            }
        } else {
            meter.incUnacked();
        }
    }

    private void log(Logger subLogger, SubscribeOptions opt, InboundMessage m, DispatchContext ctx, long latencyMs) {
        if (ctx.getError() == null && !opt.getLogLevel().logSuccess()) {
            return;
        }
        LoggingEventBuilder event = ctx.getError() == null ? subLogger.atInfo() : subLogger.atError();
        event.addKeyValue("startTime", ctx.getDeliveredAt())
                .addKeyValue("latency", latencyMs)
                .addKeyValue("topic", ctx.getTopic())
                .addKeyValue("id", String.valueOf(ctx.getMessageId()))
                .addKeyValue("attempts", ctx.getAttempts())
                .addKeyValue("ignore_err", ctx.getIgnoredError() == null ? null : ctx.getIgnoredError().toString())
                .addKeyValue("error", ctx.getError() == null ? null : ctx.getError().toString())
                .log(new String(m.payload(), StandardCharsets.UTF_8));
    }
}
