package com.fastmqtt.support;

import com.fastmqtt.core.spi.InboundMessage;
import com.fastmqtt.exception.TransportException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

public class TestInboundMessage implements InboundMessage {

    private final String topic;

    private final byte[] payload;

    private final int qos;

    private final int id;

    private final Instant deliveredAt = Instant.now();

    public final AtomicInteger ackCalls = new AtomicInteger();

    /** ack 一次即放行 */
    public final CountDownLatch acked = new CountDownLatch(1);

    private volatile boolean failAck;

    public TestInboundMessage(String topic, String payload, int qos, int id) {
        this.topic = topic;
        this.payload = payload.getBytes(StandardCharsets.UTF_8);
        this.qos = qos;
        this.id = id;
    }

    public TestInboundMessage failAck() {
        this.failAck = true;
        return this;
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public byte[] payload() {
        return payload;
    }

    @Override
    public int qos() {
        return qos;
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public Instant deliveredAt() {
        return deliveredAt;
    }

    @Override
    public void ack() {
        ackCalls.incrementAndGet();
        if (failAck) {
            throw new TransportException("ack rejected, id=" + id);
        }
        acked.countDown();
    }
}
