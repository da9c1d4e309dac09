package com.fastmqtt.core.transport;

import com.fastmqtt.exception.TransportException;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PahoMqttTransportTest {

    @Test
    void plainAddressGetsTcpScheme() {
        assertThat(PahoMqttTransport.serverUri("broker.local:1883")).isEqualTo("tcp://broker.local:1883");
        assertThat(PahoMqttTransport.serverUri("ssl://broker.local:8883")).isEqualTo("ssl://broker.local:8883");
    }

    @Test
    void operationsBeforeConnectFail() {
        PahoMqttTransport transport = new PahoMqttTransport();

        assertThat(transport.isConnected()).isFalse();
        assertThatThrownBy(() -> transport.publish("orders/1", 1, false, new byte[0]))
                .isInstanceOf(TransportException.class);
        // 未连接时断开是空操作
        transport.disconnect(Duration.ofMillis(10));
    }

    @Test
    void ackIsSentOnce() throws Exception {
        MqttClient client = mock(MqttClient.class);
        MqttMessage message = new MqttMessage("{\"id\":1}".getBytes(StandardCharsets.UTF_8));
        message.setId(17);
        message.setQos(1);
        PahoInboundMessage inbound = new PahoInboundMessage(client, "orders/1", message);

        inbound.ack();
        inbound.ack();

        verify(client, times(1)).messageArrivedComplete(17, 1);
        assertThat(inbound.id()).isEqualTo(17);
        assertThat(inbound.qos()).isEqualTo(1);
        assertThat(inbound.deliveredAt()).isNotNull();
    }

    @Test
    void ackFailureIsWrapped() throws Exception {
        MqttClient client = mock(MqttClient.class);
        MqttMessage message = new MqttMessage(new byte[0]);
        message.setId(5);
        message.setQos(1);
        doThrow(new MqttException(MqttException.REASON_CODE_CLIENT_NOT_CONNECTED))
                .when(client).messageArrivedComplete(5, 1);

        PahoInboundMessage inbound = new PahoInboundMessage(client, "orders/1", message);

        assertThatThrownBy(inbound::ack)
                .isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(MqttException.class);
    }
}
