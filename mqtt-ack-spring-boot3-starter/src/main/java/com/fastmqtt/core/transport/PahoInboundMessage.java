package com.fastmqtt.core.transport;

import com.fastmqtt.core.spi.InboundMessage;
import com.fastmqtt.exception.TransportException;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Paho 投递的消息, ACK 走 messageArrivedComplete
 */
class PahoInboundMessage implements InboundMessage {

    private final MqttClient client;

    private final String topic;

    private final MqttMessage message;

    private final Instant deliveredAt;

    private final AtomicBoolean acked = new AtomicBoolean(false);

    PahoInboundMessage(MqttClient client, String topic, MqttMessage message) {
        this.client = client;
        this.topic = topic;
        this.message = message;
        this.deliveredAt = Instant.now();
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public byte[] payload() {
        return message.getPayload();
    }

    @Override
    public int qos() {
        return message.getQos();
    }

    @Override
    public int id() {
        return message.getId();
    }

    @Override
    public Instant deliveredAt() {
        return deliveredAt;
    }

    @Override
    public void ack() {
        if (!acked.compareAndSet(false, true)) {
            return;
        }
        try {
            client.messageArrivedComplete(message.getId(), message.getQos());
        } catch (MqttException e) {
            throw new TransportException("ack failed, topic=" + topic + ", id=" + message.getId(), e);
        }
    }

    @Override
    public String toString() {
        return "PahoInboundMessage{topic=" + topic + ", id=" + message.getId() + ", qos=" + message.getQos()
                + ", dup=" + message.isDuplicate() + "}";
    }
}
