package com.fastmqtt.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * 消息体编解码
 */
public interface MessageCodec {

    /**
     * 应用对象 -> 传输字节
     * 优先级固定: byte[] 原样 > 字符串取 UTF-8 字节 > 结构化编码
     */
    byte[] encode(Object value);

    <T> T decode(byte[] payload, Class<T> type);

    <T> T decode(byte[] payload, TypeReference<T> typeRef);
}
