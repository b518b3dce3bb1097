package com.reliablebus.core.spi;

import com.reliablebus.model.DeadLetterEntry;
import com.reliablebus.model.stats.DeadLetterStats;

import java.util.List;
import java.util.Optional;

/**
 * 死信存储
 */
public interface DeadLetterStore {

    /**
     * 写入; 同 id 覆盖, 容量满时淘汰 createdAt 最早的条目
     */
    void add(DeadLetterEntry entry);

    Optional<DeadLetterEntry> get(String messageId);

    boolean remove(String messageId);

    /**
     * 按 createdAt 倒序分页
     */
    List<DeadLetterEntry> list(int limit, int offset);

    /**
     * @return 清除的条目数
     */
    int clear();

    DeadLetterStats stats();
}
