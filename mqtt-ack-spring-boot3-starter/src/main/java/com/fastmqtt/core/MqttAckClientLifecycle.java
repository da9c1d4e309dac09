package com.fastmqtt.core;

import com.fastmqtt.config.MqttAckProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class MqttAckClientLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(MqttAckClientLifecycle.class);

    private final MqttAckClient client;

    private final ExecutorService dispatchExecutor;

    private final MqttAckProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public MqttAckClientLifecycle(MqttAckClient client, ExecutorService dispatchExecutor, MqttAckProperties props) {
        this.client = client;
        this.dispatchExecutor = dispatchExecutor;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        // 打印关键启动信息
        try {
            MqttAckClientConfig cfg = client.getConfig();
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ MqttAckClient started");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ addr                : {}", cfg.getAddr());
            log.info("│ clientId            : {}", cfg.getClientId());
            log.info("│ cleanSession        : {}", cfg.isCleanSession());
            log.info("│ automaticReconnect  : {}", cfg.isAutomaticReconnect());
            log.info("│ keepAlive           : {} s", cfg.getKeepAlive().toSeconds());
            log.info("│ disconnectGrace     : {} ms", cfg.getDisconnectGrace().toMillis());
            log.info("│ dispatch.core       : {}", props.getDispatch().getCorePoolSize());
            log.info("│ dispatch.max        : {}", props.getDispatch().getMaxPoolSize());
            log.info("│ retry.base/maxDelay : {} ms / {} ms",
                    props.getRetry().getBase().toMillis(), props.getRetry().getMaxDelay().toMillis());
            log.info("│ loggers             : {} / {} / {}",
                    props.getLogger().getClient(), props.getLogger().getPub(), props.getLogger().getSub());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            log.warn("[Mqtt-Client] failed to render startup banner: {}", t.toString());
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Mqtt-Client] stop skipped: already stopped");
            return;
        }
        log.info("[Mqtt-Client] stopping... clientId={}", client.getConfig().getClientId());
        try {
            gracefulShutdown(props.getShutdown().getAwait().toMillis());
        } finally {
            client.disconnect();
            log.info("[Mqtt-Client] stopped, clientId={}", client.getConfig().getClientId());
        }
    }

    /**
     * 停止接收新消息, 等待在途处理完成; 未完成的消息不 ACK, 由 broker 重投
     */
    void gracefulShutdown(long awaitMillis) {
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(awaitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("[Mqtt-Client] in-flight dispatches still running after {} ms, disconnecting anyway", awaitMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Mqtt-Client] interrupted while awaiting in-flight dispatches");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
