package com.reliablebus.core.store;

import com.reliablebus.core.spi.TopicStore;
import com.reliablebus.model.Topic;
import com.reliablebus.model.TopicPage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 单节点内存 topic 存储, 按名称有序
 * 分页 token 为上一页最后一个 topic 名
 */
public class InMemoryTopicStore implements TopicStore {

    private final ConcurrentSkipListMap<String, Topic> topics = new ConcurrentSkipListMap<>();

    @Override
    public void save(Topic topic) {
        topics.put(topic.getName(), topic);
    }

    @Override
    public Optional<Topic> get(String name) {
        return Optional.ofNullable(topics.get(name));
    }

    @Override
    public boolean exists(String name) {
        return topics.containsKey(name);
    }

    @Override
    public boolean delete(String name) {
        return topics.remove(name) != null;
    }

    @Override
    public TopicPage list(int pageSize, String pageToken) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1, got " + pageSize);
        }
        Iterator<Topic> it = (pageToken == null || pageToken.isEmpty()
                ? topics.values()
                : topics.tailMap(pageToken, false).values()).iterator();
        List<Topic> page = new ArrayList<>(pageSize);
        while (it.hasNext() && page.size() < pageSize) {
            page.add(it.next());
        }
        String next = it.hasNext() && !page.isEmpty() ? page.get(page.size() - 1).getName() : null;
        return new TopicPage(page, next, topics.size());
    }
}
