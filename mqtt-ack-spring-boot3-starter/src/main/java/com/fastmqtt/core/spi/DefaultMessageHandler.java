package com.fastmqtt.core.spi;

/**
 * 兜底处理器: 未匹配任何显式订阅的消息交给它, 客户端必须提供
 */
@FunctionalInterface
public interface DefaultMessageHandler extends MessageHandler {
}
