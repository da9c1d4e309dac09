package com.fastmqtt.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * MQTT 指标使用的注册表
 * 应用已有注册表（Prometheus 等）时直接挂到其下; 一个都没有时才用内存注册表兜底
 */
public class MqttMeterRegistryProvider {

    private static final Logger log = LoggerFactory.getLogger(MqttMeterRegistryProvider.class);

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    private final boolean fallback;

    public MqttMeterRegistryProvider(List<MeterRegistry> discovered) {
        if (discovered != null) {
            for (MeterRegistry registry : discovered) {
                // 复合注册表拆开, 挂它的下游
                if (registry instanceof CompositeMeterRegistry nested) {
                    nested.getRegistries().forEach(composite::add);
                } else {
                    composite.add(registry);
                }
            }
        }
        this.fallback = composite.getRegistries().isEmpty();
        if (fallback) {
            composite.add(new SimpleMeterRegistry());
            log.info("[Mqtt-Metrics] no MeterRegistry discovered, using in-memory registry");
        }
    }

    public MeterRegistry getRegistry() {
        return composite;
    }

    /** 是否使用的是兜底内存注册表 */
    public boolean isFallback() {
        return fallback;
    }
}
