package com.fastmqtt.model.ctx;

import com.fastmqtt.model.enums.DeliveryState;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 单条投递的处理上下文, 仅在一次派发内有效, 不跨线程共享
 */
@Data
@Builder
public class DispatchContext {

    private String topic;
    private int messageId;
    private int qos;
    private Instant deliveredAt;
    @Builder.Default
    private DeliveryState state = DeliveryState.RECEIVED;
    /** handler 实际执行次数 */
    private int attempts;
    /** 被降级的业务错误 */
    private Throwable ignoredError;
    /** 最终系统错误 */
    private Throwable error;

    public void incAttempts() { attempts++; }
}
