package com.fastmqtt.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fastmqtt.core.spi.MessageCodec;
import com.fastmqtt.exception.PayloadEncodingException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class JacksonMessageCodec implements MessageCodec {

    /** 支持的消息体类型, 按优先级排列 */
    public enum PayloadKind {
        RAW, TEXT, STRUCTURED;

        public static PayloadKind of(Object value) {
            if (value instanceof byte[]) {
                return RAW;
            }
            // 字符串不能再走 JSON, 否则会被加上引号
            if (value instanceof CharSequence) {
                return TEXT;
            }
            return STRUCTURED;
        }
    }

    private final ObjectMapper mapper;

    /** 使用推荐的默认配置构造 */
    public JacksonMessageCodec() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonMessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(Object value) {
        if (value == null) {
            throw new PayloadEncodingException("payload must not be null");
        }
        return switch (PayloadKind.of(value)) {
            case RAW -> (byte[]) value;
            case TEXT -> value.toString().getBytes(StandardCharsets.UTF_8);
            case STRUCTURED -> writeJson(value);
        };
    }

    private byte[] writeJson(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new PayloadEncodingException("Failed to serialize payload to JSON, type="
                    + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T decode(byte[] payload, Class<T> type) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new PayloadEncodingException("Failed to deserialize payload from JSON", e);
        }
    }

    @Override
    public <T> T decode(byte[] payload, TypeReference<T> typeRef) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.readValue(payload, typeRef);
        } catch (IOException e) {
            throw new PayloadEncodingException("Failed to deserialize payload from JSON", e);
        }
    }

    public static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        // 反序列化忽略未知字段，增强前后兼容
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // 自动发现（如 JDK8 Optional、JSR310 等）
        m.findAndRegisterModules();
        return m;
    }
}
