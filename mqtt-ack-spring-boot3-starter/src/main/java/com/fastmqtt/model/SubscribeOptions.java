package com.fastmqtt.model;

import com.fastmqtt.core.retry.LocalRetry;
import com.fastmqtt.model.enums.LogLevel;
import com.fastmqtt.model.enums.Qos;
import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;

@Data
@Builder(toBuilder = true)
public class SubscribeOptions {

    @Builder.Default
    private Qos qos = Qos.AT_LEAST_ONCE;

    @Builder.Default
    private LogLevel logLevel = LogLevel.INFO;

    /** handler 本地重试, 为空则只执行一次 */
    private LocalRetry localRetry;

    /** 覆盖客户端默认的订阅日志 */
    private Logger subLogger;

    public static SubscribeOptions defaults() {
        return SubscribeOptions.builder().build();
    }
}
