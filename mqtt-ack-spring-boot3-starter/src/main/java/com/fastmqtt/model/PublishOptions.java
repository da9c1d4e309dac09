package com.fastmqtt.model;

import com.fastmqtt.core.retry.LocalRetry;
import com.fastmqtt.model.enums.LogLevel;
import com.fastmqtt.model.enums.Qos;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class PublishOptions {

    @Builder.Default
    private Qos qos = Qos.AT_LEAST_ONCE;

    @Builder.Default
    private boolean retained = false;

    @Builder.Default
    private LogLevel logLevel = LogLevel.INFO;

    /** 本地重试, 为空则只发一次 */
    private LocalRetry localRetry;

    public static PublishOptions defaults() {
        return PublishOptions.builder().build();
    }
}
