package com.fastmqtt.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class MqttAckMetrics {
    private final Counter publishSuccess;
    private final Counter publishFailed;
    private final Counter acked;
    private final Counter ignored;
    private final Counter unacked;
    private final Counter rejected;
    private final DistributionSummary attempts;
    private final Timer publishTimer;
    private final Timer dispatchLatency;

    private MqttAckMetrics(MeterRegistry reg) {
        this.publishSuccess = Counter.builder("mqtt.publish.success").description("messages published").register(reg);
        this.publishFailed  = Counter.builder("mqtt.publish.failed").description("publish calls failed").register(reg);
        this.acked    = Counter.builder("mqtt.dispatch.acked").description("deliveries acknowledged").register(reg);
        this.ignored  = Counter.builder("mqtt.dispatch.ignored").description("business errors acknowledged").register(reg);
        this.unacked  = Counter.builder("mqtt.dispatch.unacked").description("deliveries left for redelivery").register(reg);
        this.rejected = Counter.builder("mqtt.dispatch.rejected").description("deliveries rejected by executor").register(reg);
        this.attempts = DistributionSummary.builder("mqtt.handler.attempts")
                .description("handler invocations per delivery").baseUnit("times").register(reg);
        this.publishTimer    = Timer.builder("mqtt.publish.time").description("publish call time incl. retry").register(reg);
        this.dispatchLatency = Timer.builder("mqtt.dispatch.latency").description("time from arrival to completion").register(reg);
    }

    public static MqttAckMetrics create(MeterRegistry reg) { return new MqttAckMetrics(reg); }

    public void incPublishSuccess(){ publishSuccess.increment(); }
    public void incPublishFailed(){  publishFailed.increment(); }
    public void incAcked(){    acked.increment(); }
    public void incIgnored(){  ignored.increment(); }
    public void incUnacked(){  unacked.increment(); }
    public void incRejected(){ rejected.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordPublishMillis(long millis){ publishTimer.record(millis, TimeUnit.MILLISECONDS); }
    public void recordDispatchMillis(long millis){ dispatchLatency.record(millis, TimeUnit.MILLISECONDS); }
}
