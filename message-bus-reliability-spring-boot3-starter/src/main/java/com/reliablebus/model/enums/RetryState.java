package com.reliablebus.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 待重试消息状态
 */
@AllArgsConstructor
@Getter
public enum RetryState {
    SCHEDULED("已入队, 等待到期"),
    IN_FLIGHT("回调执行中");

    public final String desc;
}
