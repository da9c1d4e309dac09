package com.fastmqtt.autoconfig;

import com.fastmqtt.core.metric.MqttAckMetrics;
import com.fastmqtt.core.metric.MqttMeterRegistryProvider;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class MqttAckMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MqttMeterRegistryProvider mqttMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new MqttMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public MqttAckMetrics mqttAckMetrics(MqttMeterRegistryProvider provider) {
        return MqttAckMetrics.create(provider.getRegistry());
    }
}
