package com.fastmqtt.core.spi;

/**
 * 传输层回调, 引擎只记录日志, 不改变传输层行为
 */
public interface TransportCallback {

    void onConnectionAttempt(String serverUri);

    /** @param reconnect true=自动重连成功 */
    void onConnect(boolean reconnect, String serverUri);

    void onConnectionLost(Throwable cause);

    /** 未匹配任何订阅的消息 */
    void onUnroutedMessage(InboundMessage message);
}
