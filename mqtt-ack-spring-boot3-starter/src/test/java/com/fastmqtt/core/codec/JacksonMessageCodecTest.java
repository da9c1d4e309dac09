package com.fastmqtt.core.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fastmqtt.exception.PayloadEncodingException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonMessageCodecTest {

    private final JacksonMessageCodec codec = new JacksonMessageCodec();

    public static class Order {
        public int id;
        public String status;

        public Order() {
        }

        Order(int id, String status) {
            this.id = id;
            this.status = status;
        }
    }

    @Test
    void rawBytesPassThroughUntouched() {
        byte[] raw = {0x00, (byte) 0xff, 0x7b};

        assertThat(codec.encode(raw)).isSameAs(raw);
    }

    @Test
    void stringIsUtf8WithoutQuotes() {
        assertThat(codec.encode("订单 ok")).isEqualTo("订单 ok".getBytes(StandardCharsets.UTF_8));
        assertThat(codec.encode(new StringBuilder("abc"))).isEqualTo("abc".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void structuredValueIsJson() {
        byte[] out = codec.encode(Map.of("id", 1));

        assertThat(new String(out, StandardCharsets.UTF_8)).isEqualTo("{\"id\":1}");
    }

    @Test
    void jsonDecodesBackToType() {
        byte[] out = codec.encode(new Order(7, "PAID"));

        Order back = codec.decode(out, Order.class);
        assertThat(back.id).isEqualTo(7);
        assertThat(back.status).isEqualTo("PAID");

        List<Integer> ids = codec.decode("[1,2,3]".getBytes(StandardCharsets.UTF_8), new TypeReference<List<Integer>>() { });
        assertThat(ids).containsExactly(1, 2, 3);
    }

    @Test
    void nullPayloadIsRejected() {
        assertThatThrownBy(() -> codec.encode(null)).isInstanceOf(PayloadEncodingException.class);
    }

    public static class BrokenGetter {
        public String getStatus() {
            throw new IllegalStateException("status unavailable");
        }
    }

    @Test
    void unserializableValueFails() {
        assertThatThrownBy(() -> codec.encode(new BrokenGetter()))
                .isInstanceOf(PayloadEncodingException.class)
                .hasMessageContaining(BrokenGetter.class.getName())
                .hasCauseInstanceOf(java.io.IOException.class);
    }

    @Test
    void malformedJsonFailsToDecode() {
        assertThatThrownBy(() -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8), Order.class))
                .isInstanceOf(PayloadEncodingException.class);
    }

    @Test
    void payloadKindPrecedence() {
        assertThat(JacksonMessageCodec.PayloadKind.of(new byte[0])).isEqualTo(JacksonMessageCodec.PayloadKind.RAW);
        assertThat(JacksonMessageCodec.PayloadKind.of("x")).isEqualTo(JacksonMessageCodec.PayloadKind.TEXT);
        assertThat(JacksonMessageCodec.PayloadKind.of(42)).isEqualTo(JacksonMessageCodec.PayloadKind.STRUCTURED);
    }
}
