package com.fastmqtt.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单条投递消息的处理状态
 * RECEIVED -> PROCESSING -> {IGNORED_SUCCESS, IGNORED_BUSINESS_ERROR} -> ACKNOWLEDGED
 * RECEIVED -> PROCESSING -> SYSTEM_ERROR -> DROPPED_UNACKNOWLEDGED
 */
@AllArgsConstructor
@Getter
public enum DeliveryState {
    RECEIVED(false, "已收到, 待派发"),
    PROCESSING(false, "handler 执行中（含本地重试）"),
    IGNORED_SUCCESS(false, "handler 成功"),
    IGNORED_BUSINESS_ERROR(false, "业务错误, 按成功处理"),
    SYSTEM_ERROR(false, "系统错误"),
    ACKNOWLEDGED(true, "已 ACK，终态"),
    DROPPED_UNACKNOWLEDGED(true, "未 ACK，等待 broker 重投，终态")
    ;

    public final boolean terminal;
    public final String desc;
}
