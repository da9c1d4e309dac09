package com.fastmqtt.autoconfig;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fastmqtt.core.MqttAckClient;
import com.fastmqtt.core.MqttAckClientLifecycle;
import com.fastmqtt.core.codec.JacksonMessageCodec;
import com.fastmqtt.core.metric.MqttAckMetrics;
import com.fastmqtt.core.spi.DefaultMessageHandler;
import com.fastmqtt.core.spi.ErrorClassifier;
import com.fastmqtt.core.spi.MessageCodec;
import com.fastmqtt.core.spi.MqttTransport;
import com.fastmqtt.exception.MqttConfigurationException;
import com.fastmqtt.support.RecordingTransport;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class MqttAckAutoConfigurationTest {

    private final RecordingTransport transport = new RecordingTransport();

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(MqttAckMetricsAutoConfiguration.class, MqttAckAutoConfiguration.class))
            .withBean(MqttTransport.class, () -> transport);

    private final DefaultMessageHandler fallback = (topic, payload) -> { };

    @Test
    void inactiveWithoutAddress() {
        runner.run(context -> {
            assertThat(context).doesNotHaveBean(MqttAckClient.class);
            assertThat(context).hasSingleBean(MqttAckMetrics.class);
        });
    }

    @Test
    void wiresClientFromProperties() {
        runner.withBean(DefaultMessageHandler.class, () -> fallback)
                .withPropertyValues(
                        "spring.application.name=order-service",
                        "mqtt.addr=127.0.0.1:1883",
                        "mqtt.user-name=svc",
                        "mqtt.password=secret",
                        "mqtt.disconnect-grace=100ms",
                        "mqtt.dispatch.max-pool-size=16",
                        "mqtt.ignorable-exceptions=java.lang.IllegalArgumentException")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(MqttAckClient.class);
                    assertThat(context).hasSingleBean(MqttAckClientLifecycle.class);
                    assertThat(context.getBean(MessageCodec.class)).isInstanceOf(JacksonMessageCodec.class);

                    MqttAckClient client = context.getBean(MqttAckClient.class);
                    assertThat(client.isConnected()).isTrue();
                    assertThat(transport.connectedWith.getClientId()).isEqualTo("order-service");
                    assertThat(transport.connectedWith.getDisconnectGrace()).isEqualTo(Duration.ofMillis(100));
                    assertThat(transport.connectedWith.getPubLogger().getName()).isEqualTo("mqtt-pub");

                    ErrorClassifier classifier = context.getBean(ErrorClassifier.class);
                    assertThat(classifier.isIgnorable(new IllegalArgumentException("bad id"))).isTrue();

                    ExecutorService executor = context.getBean("mqttDispatchExecutor", ExecutorService.class);
                    assertThat(executor).isInstanceOf(ThreadPoolExecutor.class);
                    assertThat(((ThreadPoolExecutor) executor).getMaximumPoolSize()).isEqualTo(16);
                    assertThat(((ThreadPoolExecutor) executor).getCorePoolSize()).isZero();
                });

        // 关闭容器时断开连接
        assertThat(transport.disconnectCalls).hasValue(1);
    }

    @Test
    void failsWithoutDefaultHandler() {
        runner.withPropertyValues(
                        "mqtt.addr=127.0.0.1:1883",
                        "mqtt.user-name=svc",
                        "mqtt.password=secret",
                        "mqtt.client-id=c1")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(MqttConfigurationException.class)
                            .hasMessage("DefaultHandler must be set");
                    assertThat(transport.callback).isNull();
                });
    }

    @Test
    void appliesLoggerLevels() {
        String subName = "mqtt-sub-level-" + System.nanoTime();
        Logger sub = (Logger) LoggerFactory.getLogger(subName);
        try {
            runner.withBean(DefaultMessageHandler.class, () -> fallback)
                    .withBean(LoggingSystem.class, () -> LoggingSystem.get(getClass().getClassLoader()))
                    .withPropertyValues(
                            "mqtt.addr=127.0.0.1:1883",
                            "mqtt.user-name=svc",
                            "mqtt.password=secret",
                            "mqtt.client-id=c1",
                            "mqtt.logger.sub=" + subName,
                            "mqtt.logger.sub-level=error")
                    .run(context -> {
                        assertThat(context).hasNotFailed();
                        assertThat(sub.getLevel()).isEqualTo(Level.ERROR);
                        assertThat(transport.connectedWith.getSubLogger().getName()).isEqualTo(subName);
                    });
        } finally {
            sub.setLevel(null);
        }
    }
}
