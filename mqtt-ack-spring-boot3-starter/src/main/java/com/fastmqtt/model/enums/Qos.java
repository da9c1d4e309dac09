package com.fastmqtt.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * MQTT 服务质量等级
 */
@AllArgsConstructor
@Getter
public enum Qos {
    AT_MOST_ONCE(0, "最多一次"),
    AT_LEAST_ONCE(1, "至少一次, 未 ACK 的消息由 broker 重投"),
    EXACTLY_ONCE(2, "恰好一次")
    ;

    public final int code;
    public final String desc;

    public static Qos of(int code) {
        for (Qos q : values()) {
            if (q.code == code) {
                return q;
            }
        }
        throw new IllegalArgumentException("unsupported qos: " + code);
    }
}
