package com.fastmqtt.core.spi;

import java.time.Instant;

/**
 * 传输层投递的一条消息, 仅在一次派发内持有
 */
public interface InboundMessage {

    String topic();

    byte[] payload();

    int qos();

    /** 传输层分配的消息 id */
    int id();

    /** 到达时间, 用于计算处理延迟 */
    Instant deliveredAt();

    /**
     * 向 broker 确认已处理
     * 幂等; 引擎对每条消息最多调用一次
     */
    void ack();
}
