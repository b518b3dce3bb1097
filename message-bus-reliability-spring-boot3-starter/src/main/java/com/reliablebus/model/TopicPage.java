package com.reliablebus.model;

import lombok.Value;

import java.util.List;

/**
 * topic 分页结果
 */
@Value
public class TopicPage {

    List<Topic> topics;

    /** 最后一页为 null */
    String nextPageToken;

    long totalCount;
}
