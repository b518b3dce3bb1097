package com.reliablebus.core.spi;

import com.reliablebus.model.Topic;
import com.reliablebus.model.TopicPage;

import java.util.Optional;

/**
 * topic 元数据存储
 */
public interface TopicStore {

    void save(Topic topic);

    Optional<Topic> get(String name);

    boolean exists(String name);

    boolean delete(String name);

    /**
     * @param pageToken 上一页返回的 token, 首页为 null
     */
    TopicPage list(int pageSize, String pageToken);
}
