package com.fastmqtt.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fastmqtt.config.MqttAckProperties;
import com.fastmqtt.core.MqttAckClient;
import com.fastmqtt.core.MqttAckClientConfig;
import com.fastmqtt.core.MqttAckClientLifecycle;
import com.fastmqtt.core.classifier.DefaultErrorClassifier;
import com.fastmqtt.core.codec.JacksonMessageCodec;
import com.fastmqtt.core.metric.MqttAckMetrics;
import com.fastmqtt.core.spi.DefaultMessageHandler;
import com.fastmqtt.core.spi.ErrorClassifier;
import com.fastmqtt.core.spi.MessageCodec;
import com.fastmqtt.core.spi.MqttTransport;
import com.fastmqtt.core.transport.PahoMqttTransport;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.LinkedHashSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * MQTT 客户端装配: 编码/错误分级/派发线程池/传输层/客户端/生命周期
 * 仅在配置了 mqtt.addr 时生效
 */
@AutoConfiguration(after = MqttAckMetricsAutoConfiguration.class)
@EnableConfigurationProperties(MqttAckProperties.class)
@ConditionalOnProperty(prefix = "mqtt", name = "addr")
public class MqttAckAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MqttAckAutoConfiguration.class);

    /**
     * 默认编码, 优先复用应用的 ObjectMapper
     */
    @Bean
    @ConditionalOnMissingBean(MessageCodec.class)
    public MessageCodec messageCodec(ObjectProvider<ObjectMapper> mapper) {
        return new JacksonMessageCodec(mapper.getIfAvailable(JacksonMessageCodec::createDefaultMapper));
    }

    /**
     * 默认错误分级
     */
    @Bean
    @ConditionalOnMissingBean(ErrorClassifier.class)
    public ErrorClassifier errorClassifier(MqttAckProperties props) {
        return new DefaultErrorClassifier(new LinkedHashSet<>(props.getIgnorableExceptions()));
    }

    /**
     * 派发线程池, 每条消息一个任务
     * SynchronousQueue 不排队: 有空闲线程就复用, 否则新建, 达到上限直接拒绝
     */
    @Bean("mqttDispatchExecutor")
    @ConditionalOnMissingBean(name = "mqttDispatchExecutor")
    public ExecutorService mqttDispatchExecutor(MqttAckProperties props) {
        MqttAckProperties.Dispatch dispatch = props.getDispatch();
        return new ThreadPoolExecutor(
                dispatch.getCorePoolSize(),
                dispatch.getMaxPoolSize(),
                dispatch.getKeepAlive().toMillis(),
                TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(),
                new NamedThreadFactory("mqtt-dispatch"),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean
    @ConditionalOnMissingBean(MqttTransport.class)
    public MqttTransport mqttTransport() {
        return new PahoMqttTransport();
    }

    /**
     * 客户端, 创建即连接
     */
    @Bean
    @ConditionalOnMissingBean
    public MqttAckClient mqttAckClient(MqttAckProperties props,
                                       MqttTransport transport,
                                       MessageCodec codec,
                                       ErrorClassifier classifier,
                                       @Qualifier("mqttDispatchExecutor") ExecutorService dispatchExecutor,
                                       ObjectProvider<MqttAckMetrics> meter,
                                       ObjectProvider<DefaultMessageHandler> defaultHandler,
                                       ObjectProvider<LoggingSystem> loggingSystem,
                                       Environment env) {
        MqttAckProperties.Logger names = props.getLogger();
        loggingSystem.ifAvailable(ls -> {
            applyLevel(ls, names.getClient(), names.getClientLevel());
            applyLevel(ls, names.getPub(), names.getPubLevel());
            applyLevel(ls, names.getSub(), names.getSubLevel());
        });

        String clientId = props.getClientId();
        if (clientId == null || clientId.isBlank()) {
            clientId = env.getProperty("spring.application.name");
        }

        MqttAckClientConfig config = MqttAckClientConfig.builder()
                .addr(props.getAddr())
                .userName(props.getUserName())
                .password(props.getPassword())
                .clientId(clientId)
                .cleanSession(props.isCleanSession())
                .debug(props.isDebug())
                .automaticReconnect(props.isAutomaticReconnect())
                .connectionTimeout(props.getConnectionTimeout())
                .keepAlive(props.getKeepAlive())
                .disconnectGrace(props.getDisconnectGrace())
                .defaultHandler(defaultHandler.getIfAvailable())
                .clientLogger(LoggerFactory.getLogger(names.getClient()))
                .pubLogger(LoggerFactory.getLogger(names.getPub()))
                .subLogger(LoggerFactory.getLogger(names.getSub()))
                .build();
        log.info("[Mqtt-AutoConfig] creating client, {}", config);
        return new MqttAckClient(config, transport, codec, classifier, dispatchExecutor,
                meter.getIfAvailable(), props.getRetry().getBase(), props.getRetry().getMaxDelay());
    }

    @Bean
    @ConditionalOnMissingBean
    public MqttAckClientLifecycle mqttAckClientLifecycle(MqttAckClient client,
                                                         @Qualifier("mqttDispatchExecutor") ExecutorService dispatchExecutor,
                                                         MqttAckProperties props) {
        return new MqttAckClientLifecycle(client, dispatchExecutor, props);
    }

    private static void applyLevel(LoggingSystem ls, String name, LogLevel level) {
        if (level != null) {
            ls.setLogLevel(name, level);
        }
    }
}
