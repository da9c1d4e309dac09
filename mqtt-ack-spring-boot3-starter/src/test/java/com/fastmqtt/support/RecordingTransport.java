package com.fastmqtt.support;

import com.fastmqtt.core.MqttAckClientConfig;
import com.fastmqtt.core.spi.InboundMessage;
import com.fastmqtt.core.spi.MqttTransport;
import com.fastmqtt.core.spi.TransportCallback;
import com.fastmqtt.exception.TransportException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 内存传输层, 记录所有调用, 可按顺序预置失败
 */
public class RecordingTransport implements MqttTransport {

    public static final class Published {
        public final String topic;
        public final int qos;
        public final boolean retained;
        public final byte[] payload;

        Published(String topic, int qos, boolean retained, byte[] payload) {
            this.topic = topic;
            this.qos = qos;
            this.retained = retained;
            this.payload = payload;
        }
    }

    public final List<Published> published = new CopyOnWriteArrayList<>();

    public final Map<String, Consumer<InboundMessage>> subscriptions = new ConcurrentHashMap<>();

    public final Map<String, Integer> subscribedQos = new ConcurrentHashMap<>();

    public final AtomicInteger publishCalls = new AtomicInteger();

    public final AtomicInteger disconnectCalls = new AtomicInteger();

    public volatile MqttAckClientConfig connectedWith;

    public volatile TransportCallback callback;

    public volatile Duration disconnectGrace;

    /** 每次 publish 依次弹出一个, 为空则成功 */
    private final Deque<RuntimeException> publishFailures = new ArrayDeque<>();

    private volatile RuntimeException connectFailure;

    private volatile RuntimeException subscribeFailure;

    public RecordingTransport failPublish(RuntimeException... errors) {
        synchronized (publishFailures) {
            publishFailures.addAll(List.of(errors));
        }
        return this;
    }

    public RecordingTransport failConnect(RuntimeException error) {
        this.connectFailure = error;
        return this;
    }

    public RecordingTransport failSubscribe(RuntimeException error) {
        this.subscribeFailure = error;
        return this;
    }

    @Override
    public void connect(MqttAckClientConfig config, TransportCallback callback) {
        this.callback = callback;
        callback.onConnectionAttempt("tcp://" + config.getAddr());
        if (connectFailure != null) {
            throw connectFailure;
        }
        this.connectedWith = config;
        callback.onConnect(false, "tcp://" + config.getAddr());
    }

    @Override
    public void publish(String topic, int qos, boolean retained, byte[] payload) {
        publishCalls.incrementAndGet();
        RuntimeException err;
        synchronized (publishFailures) {
            err = publishFailures.poll();
        }
        if (err != null) {
            throw err;
        }
        published.add(new Published(topic, qos, retained, payload));
    }

    @Override
    public void subscribe(String topicFilter, int qos, Consumer<InboundMessage> callback) {
        if (subscribeFailure != null) {
            throw subscribeFailure;
        }
        subscriptions.put(topicFilter, callback);
        subscribedQos.put(topicFilter, qos);
    }

    @Override
    public void disconnect(Duration grace) {
        disconnectCalls.incrementAndGet();
        disconnectGrace = grace;
        connectedWith = null;
    }

    @Override
    public boolean isConnected() {
        return connectedWith != null;
    }

    /** 模拟 broker 投递; 没有匹配的订阅时走兜底回调 */
    public void deliver(TestInboundMessage m) {
        Consumer<InboundMessage> c = subscriptions.get(m.topic());
        if (c != null) {
            c.accept(m);
        } else {
            callback.onUnroutedMessage(m);
        }
    }

    public static TransportException brokerDown() {
        return new TransportException("broker unavailable");
    }
}
