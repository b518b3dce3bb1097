package com.reliablebus.core.spi;

import com.reliablebus.model.Message;

/**
 * 消息编解码（写入 broker 的信封格式）
 */
public interface MessageCodec {

    byte[] encode(Message message);

    Message decode(byte[] bytes);
}
