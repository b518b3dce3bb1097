package com.reliablebus.core.serializer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.reliablebus.core.spi.MessageCodec;
import com.reliablebus.model.Message;

import java.io.IOException;

/**
 * JSON 信封: 整条消息写入 broker, 读取时可还原 id / 属性 / 发布时间
 */
public class JacksonMessageCodec implements MessageCodec {

    private final ObjectMapper mapper;

    public JacksonMessageCodec() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonMessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(Message message) {
        try {
            return mapper.writeValueAsBytes(message);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to serialize message " + message.getMessageId() + " to JSON", e);
        }
    }

    @Override
    public Message decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalStateException("empty record value");
        }
        try {
            return mapper.readValue(bytes, Message.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize message envelope from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.enable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 忽略未知字段, 兼容新旧信封
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        m.findAndRegisterModules();
        return m;
    }
}
