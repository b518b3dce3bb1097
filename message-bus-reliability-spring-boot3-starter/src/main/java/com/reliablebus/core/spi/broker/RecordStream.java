package com.reliablebus.core.spi.broker;

import java.time.Duration;

/**
 * broker 记录流
 */
public interface RecordStream extends AutoCloseable {

    /**
     * @return 下一条记录; 等待 timeout 仍无数据或已读完时返回 null
     */
    BrokerRecord poll(Duration timeout) throws Exception;

    @Override
    void close();
}
