package com.fastmqtt.core.transport;

import com.fastmqtt.core.MqttAckClientConfig;
import com.fastmqtt.core.spi.InboundMessage;
import com.fastmqtt.core.spi.MqttTransport;
import com.fastmqtt.core.spi.TransportCallback;
import com.fastmqtt.exception.MqttConnectionException;
import com.fastmqtt.exception.TransportException;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * 基于 Eclipse Paho mqttv3 的传输层
 * 手动 ACK + 自动重连 + 内存持久化
 */
public class PahoMqttTransport implements MqttTransport {

    private static final Logger log = LoggerFactory.getLogger(PahoMqttTransport.class);

    /** 强制断开时等待 DISCONNECT 报文发送的时长 */
    private static final long FORCIBLY_DISCONNECT_TIMEOUT_MS = 1_000;

    private volatile MqttClient client;

    @Override
    public void connect(MqttAckClientConfig config, TransportCallback callback) {
        String serverUri = serverUri(config.getAddr());
        try {
            client = new MqttClient(serverUri, config.getClientId(), new MemoryPersistence());
        } catch (MqttException e) {
            throw new MqttConnectionException(config.getAddr(), e);
        }
        client.setManualAcks(true);
        client.setCallback(new CallbackAdapter(client, callback));

        MqttConnectOptions options = new MqttConnectOptions();
        options.setUserName(config.getUserName());
        options.setPassword(config.getPassword().toCharArray());
        options.setCleanSession(config.isCleanSession());
        options.setAutomaticReconnect(config.isAutomaticReconnect());
        options.setConnectionTimeout((int) config.getConnectionTimeout().toSeconds());
        options.setKeepAliveInterval((int) config.getKeepAlive().toSeconds());

        callback.onConnectionAttempt(serverUri);
        try {
            client.connect(options);
        } catch (MqttException e) {
            closeQuietly();
            throw new MqttConnectionException(config.getAddr(), e);
        }
        log.info("[Mqtt-Transport] connected, serverUri={}, clientId={}", serverUri, config.getClientId());
    }

    @Override
    public void publish(String topic, int qos, boolean retained, byte[] payload) {
        try {
            requireClient().publish(topic, payload, qos, retained);
        } catch (MqttException e) {
            throw new TransportException("publish failed, topic=" + topic, e);
        }
    }

    @Override
    public void subscribe(String topicFilter, int qos, Consumer<InboundMessage> callback) {
        MqttClient c = requireClient();
        try {
            c.subscribe(topicFilter, qos, (topic, message) -> callback.accept(new PahoInboundMessage(c, topic, message)));
        } catch (MqttException e) {
            throw new TransportException("subscribe failed, topic=" + topicFilter, e);
        }
    }

    @Override
    public void disconnect(Duration grace) {
        MqttClient c = client;
        if (c == null) {
            return;
        }
        try {
            if (c.isConnected()) {
                c.disconnect(grace.toMillis());
            }
        } catch (MqttException e) {
            log.warn("[Mqtt-Transport] graceful disconnect failed, forcing, reason={}", e.toString());
            try {
                c.disconnectForcibly(grace.toMillis(), FORCIBLY_DISCONNECT_TIMEOUT_MS);
            } catch (MqttException ex) {
                log.warn("[Mqtt-Transport] forced disconnect failed, reason={}", ex.toString());
            }
        } finally {
            closeQuietly();
        }
    }

    @Override
    public boolean isConnected() {
        MqttClient c = client;
        return c != null && c.isConnected();
    }

    static String serverUri(String addr) {
        return addr.contains("://") ? addr : "tcp://" + addr;
    }

    private MqttClient requireClient() {
        MqttClient c = client;
        if (c == null) {
            throw new TransportException("transport not connected");
        }
        return c;
    }

    private void closeQuietly() {
        MqttClient c = client;
        if (c == null) {
            return;
        }
        try {
            c.close();
        } catch (MqttException e) {
            log.warn("[Mqtt-Transport] close failed, reason={}", e.toString());
        }
    }

    /**
     * Paho 回调 -> TransportCallback
     */
    private static final class CallbackAdapter implements MqttCallbackExtended {

        private final MqttClient client;

        private final TransportCallback callback;

        private CallbackAdapter(MqttClient client, TransportCallback callback) {
            this.client = client;
            this.callback = callback;
        }

        @Override
        public void connectComplete(boolean reconnect, String serverURI) {
            callback.onConnect(reconnect, serverURI);
        }

        @Override
        public void connectionLost(Throwable cause) {
            callback.onConnectionLost(cause);
        }

        /** 未命中任何订阅 listener 的消息 */
        @Override
        public void messageArrived(String topic, MqttMessage message) {
            callback.onUnroutedMessage(new PahoInboundMessage(client, topic, message));
        }

        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
            // 发布走同步等待, 这里无需处理
        }
    }
}
